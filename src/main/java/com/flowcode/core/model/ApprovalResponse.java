package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A human's answer to an {@link ApprovalRequest}.
 *
 * @param approved       whether the action may proceed
 * @param feedback       free-text reason or comment
 * @param modifiedAction replacement action to run instead of the requested one, may be null
 * @param respondedAt    when the decision was made
 */
public record ApprovalResponse(
    boolean approved,
    String feedback,
    AgentAction modifiedAction,
    Instant respondedAt
) implements Serializable {

    public static ApprovalResponse approve(String feedback) {
        return new ApprovalResponse(true, feedback, null, Instant.now());
    }

    public static ApprovalResponse reject(String feedback) {
        return new ApprovalResponse(false, feedback, null, Instant.now());
    }
}
