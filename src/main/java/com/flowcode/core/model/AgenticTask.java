package com.flowcode.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One user goal and its plan. Instances are immutable snapshots; the state store
 * holds the authoritative copy and every change produces a new instance.
 *
 * @param id                  unique identifier (e.g., "FLOW-0001-3f9a")
 * @param goal                the free-form user goal
 * @param steps               ordered steps, already in a valid dependency order
 * @param status              lifecycle status
 * @param priority            scheduling priority
 * @param riskLevel           aggregate risk over all steps
 * @param estimatedDurationMs planner estimate
 * @param actualDurationMs    measured duration, set on terminal status
 * @param approvalRequired    whether the task needs human approval to proceed
 * @param context             read-only workspace snapshot
 * @param metadata            timestamps, version, tags, annotations
 * @param progress            derived step counts
 * @param approvals           approval requests raised for this task
 * @param interventions       interventions received
 * @param feedback            end-of-task feedback, may be null
 * @param learning            learning entry derived from the run, may be null
 */
public record AgenticTask(
    String id,
    String goal,
    List<TaskStep> steps,
    TaskStatus status,
    Priority priority,
    RiskLevel riskLevel,
    long estimatedDurationMs,
    Long actualDurationMs,
    boolean approvalRequired,
    TaskContext context,
    TaskMetadata metadata,
    TaskProgress progress,
    List<ApprovalRequest> approvals,
    List<HumanIntervention> interventions,
    UserFeedback feedback,
    LearningData learning
) implements Serializable {

    public AgenticTask {
        steps = steps == null ? List.of() : List.copyOf(steps);
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
        interventions = interventions == null ? List.of() : List.copyOf(interventions);
    }

    public Optional<TaskStep> findStep(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public AgenticTask withStatus(TaskStatus status) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, interventions, feedback, learning);
    }

    /** Replaces the step list and recomputes progress. */
    public AgenticTask withSteps(List<TaskStep> steps) {
        var recomputed = TaskProgress.of(steps, estimatedDurationMs,
                progress != null ? progress.currentStepId() : null);
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), recomputed,
                approvals, interventions, feedback, learning);
    }

    /** Replaces the step with the same id and recomputes progress. */
    public AgenticTask withStep(TaskStep step) {
        var updated = new ArrayList<TaskStep>(steps.size());
        boolean found = false;
        for (TaskStep existing : steps) {
            if (existing.id().equals(step.id())) {
                updated.add(step);
                found = true;
            } else {
                updated.add(existing);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Task " + id + " has no step " + step.id());
        }
        return withSteps(updated);
    }

    public AgenticTask withProgress(TaskProgress progress) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, interventions, feedback, learning);
    }

    public AgenticTask withCurrentStep(String stepId) {
        return withProgress(TaskProgress.of(steps, estimatedDurationMs, stepId));
    }

    /** Adds the request, or replaces an earlier version of it with the same id. */
    public AgenticTask withApproval(ApprovalRequest request) {
        var updated = new ArrayList<ApprovalRequest>(approvals);
        updated.removeIf(a -> a.id().equals(request.id()));
        updated.add(request);
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                updated, interventions, feedback, learning);
    }

    public AgenticTask withIntervention(HumanIntervention intervention) {
        var updated = new ArrayList<HumanIntervention>(interventions);
        updated.add(intervention);
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, updated, feedback, learning);
    }

    public AgenticTask withFeedback(UserFeedback feedback, LearningData learning) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, interventions, feedback, learning);
    }

    public AgenticTask withMetadata(TaskMetadata metadata) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata, progress,
                approvals, interventions, feedback, learning);
    }

    public AgenticTask withApprovalRequired(boolean approvalRequired) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, interventions, feedback, learning);
    }

    public AgenticTask withActualDuration(long actualDurationMs) {
        return new AgenticTask(id, goal, steps, status, priority, riskLevel, estimatedDurationMs,
                actualDurationMs, approvalRequired, context, metadata.touch(), progress,
                approvals, interventions, feedback, learning);
    }

    public AgenticTask annotate(String key, String value) {
        return withMetadata(metadata.annotate(key, value));
    }

    public boolean hasApprovalFor(String actionId) {
        return approvals.stream().anyMatch(a -> a.isApproved() && a.action().id().equals(actionId));
    }
}
