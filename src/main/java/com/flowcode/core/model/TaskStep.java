package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One dependency-ordered unit of an {@link AgenticTask}, wrapping exactly one action.
 *
 * @param id               unique within the task (e.g., "STEP-002")
 * @param action           the operation to perform
 * @param description      human-readable summary
 * @param dependencies     IDs of steps that must be {@link StepStatus#COMPLETED} first
 * @param status           current step status
 * @param result           execution result, once attempted
 * @param error            last error message, if any
 * @param startedAt        when the latest attempt started
 * @param endedAt          when the latest attempt ended
 * @param approvalRequired whether a human must approve the action before it runs
 * @param riskLevel        risk of the wrapped action
 * @param attempts         number of execution attempts so far
 */
public record TaskStep(
    String id,
    AgentAction action,
    String description,
    List<String> dependencies,
    StepStatus status,
    StepResult result,
    String error,
    Instant startedAt,
    Instant endedAt,
    boolean approvalRequired,
    RiskLevel riskLevel,
    int attempts
) implements Serializable {

    public TaskStep {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static TaskStep pending(String id, AgentAction action, List<String> dependencies) {
        return new TaskStep(id, action, action.description(), dependencies, StepStatus.PENDING,
                null, null, null, null, action.requiresApproval(), action.riskLevel(), 0);
    }

    public TaskStep withStatus(StepStatus status) {
        return new TaskStep(id, action, description, dependencies, status, result, error,
                startedAt, endedAt, approvalRequired, riskLevel, attempts);
    }

    public TaskStep started(Instant at) {
        return new TaskStep(id, action, description, dependencies, StepStatus.EXECUTING, result, null,
                at, null, approvalRequired, riskLevel, attempts + 1);
    }

    public TaskStep finished(StepStatus status, StepResult result, String error, Instant at) {
        return new TaskStep(id, action, description, dependencies, status, result, error,
                startedAt, at, approvalRequired, riskLevel, attempts);
    }

    public TaskStep skipped(String reason) {
        return new TaskStep(id, action, description, dependencies, StepStatus.SKIPPED, result, reason,
                startedAt, endedAt != null ? endedAt : Instant.now(), approvalRequired, riskLevel, attempts);
    }

    /** Puts the step back in line for another attempt, keeping the attempt count. */
    public TaskStep resetForRetry() {
        return new TaskStep(id, action, description, dependencies, StepStatus.PENDING, null, error,
                null, null, approvalRequired, riskLevel, attempts);
    }

    public TaskStep withAction(AgentAction action) {
        return new TaskStep(id, action, action.description(), dependencies, status, result, error,
                startedAt, endedAt, action.requiresApproval(), action.riskLevel(), attempts);
    }

    public TaskStep withDependencies(List<String> dependencies) {
        return new TaskStep(id, action, description, dependencies, status, result, error,
                startedAt, endedAt, approvalRequired, riskLevel, attempts);
    }
}
