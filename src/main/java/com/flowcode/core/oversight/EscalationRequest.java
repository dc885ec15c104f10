package com.flowcode.core.oversight;

import com.flowcode.core.execution.FailureKind;
import com.flowcode.core.model.AgentAction;

import java.util.List;

/**
 * A step failure presented to a human for a retry/skip/abort decision.
 *
 * @param taskId      owning task
 * @param goal        the task goal, for context
 * @param stepId      the failed step
 * @param action      the failed step's action
 * @param kind        classified failure
 * @param message     the failure reason
 * @param attempts    execution attempts so far
 * @param urgency     "critical" or "high"
 * @param suggestions remediation hints
 */
public record EscalationRequest(
    String taskId,
    String goal,
    String stepId,
    AgentAction action,
    FailureKind kind,
    String message,
    int attempts,
    String urgency,
    List<String> suggestions
) {
    public EscalationRequest {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
