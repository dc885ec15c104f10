package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * @param id           unique identifier
 * @param taskId       task the signal targets
 * @param type         pause, modify, cancel or redirect
 * @param reason       why the human intervened
 * @param instructions new goal for redirects, free text otherwise; may be null
 * @param timestamp    when the intervention was recorded
 */
public record HumanIntervention(
    String id,
    String taskId,
    InterventionType type,
    String reason,
    String instructions,
    Instant timestamp
) implements Serializable {}
