package com.flowcode.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A pending human decision blocking a step's execution.
 *
 * @param id           unique identifier (e.g., "APR-1a2b3c4d")
 * @param taskId       owning task
 * @param stepId       step whose action is gated
 * @param action       the action in question
 * @param reason       why approval is needed
 * @param risk         assessment shown to the approver
 * @param alternatives safer alternatives the approver could pick instead
 * @param status       pending until resolved
 * @param response     the decision, once resolved
 * @param requestedAt  creation time
 */
public record ApprovalRequest(
    String id,
    String taskId,
    String stepId,
    AgentAction action,
    String reason,
    RiskAssessment risk,
    List<String> alternatives,
    ApprovalStatus status,
    ApprovalResponse response,
    Instant requestedAt
) implements Serializable {

    public ApprovalRequest {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public ApprovalRequest resolve(ApprovalResponse response) {
        return new ApprovalRequest(id, taskId, stepId, action, reason, risk, alternatives,
                response.approved() ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED,
                response, requestedAt);
    }

    @JsonIgnore
    public boolean isApproved() {
        return status == ApprovalStatus.APPROVED;
    }
}
