package com.flowcode.core.state;

import com.flowcode.core.model.StepStatus;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a task's append-only execution history.
 *
 * @param taskId     owning task
 * @param stepId     step the entry is about
 * @param actionType action label (e.g. "create_file"), may be null
 * @param status     step status the entry records
 * @param durationMs wall-clock time of the attempt
 * @param success    whether the attempt succeeded
 * @param error      error message of a failed attempt
 * @param rolledBack whether changes were restored from backups
 * @param timestamp  when the entry was recorded
 */
public record ExecutionRecord(
    String taskId,
    String stepId,
    String actionType,
    StepStatus status,
    long durationMs,
    boolean success,
    String error,
    boolean rolledBack,
    Instant timestamp
) implements Serializable {}
