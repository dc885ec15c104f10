package com.flowcode.core.engine;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.TaskStatus;
import com.flowcode.core.model.UserFeedback;

import java.util.List;

/**
 * Outcome of one run of a task, reported when the run stops (terminal or paused).
 *
 * @param success         whether the task completed
 * @param task            the task as stored when the run stopped
 * @param completedSteps  steps completed so far
 * @param failedSteps     steps failed so far
 * @param totalDurationMs wall-clock time of this run
 * @param interventions   interventions recorded against the task
 * @param feedback        end-of-task feedback, may be null
 */
public record OrchestrationResult(
    boolean success,
    AgenticTask task,
    int completedSteps,
    int failedSteps,
    long totalDurationMs,
    List<HumanIntervention> interventions,
    UserFeedback feedback
) {

    static OrchestrationResult of(AgenticTask task, long durationMs) {
        return new OrchestrationResult(task.status() == TaskStatus.COMPLETED, task,
                task.progress().completedSteps(), task.progress().failedSteps(), durationMs,
                task.interventions(), task.feedback());
    }

    public TaskStatus status() {
        return task.status();
    }
}
