package com.flowcode.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Derived view of how far a task has come. Always computed from the step list.
 *
 * @param totalSteps               number of steps in the task
 * @param completedSteps           steps in {@link StepStatus#COMPLETED}
 * @param failedSteps              steps in {@link StepStatus#FAILED}
 * @param skippedSteps             steps in {@link StepStatus#SKIPPED}
 * @param percentComplete          share of steps in a terminal status, 0..100
 * @param estimatedTimeRemainingMs remaining steps times the average per-step estimate
 * @param currentStepId            step currently executing or awaiting approval, may be null
 */
public record TaskProgress(
    int totalSteps,
    int completedSteps,
    int failedSteps,
    int skippedSteps,
    int percentComplete,
    long estimatedTimeRemainingMs,
    String currentStepId
) implements Serializable {

    public static TaskProgress of(List<TaskStep> steps, long estimatedDurationMs, String currentStepId) {
        int total = steps.size();
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (TaskStep step : steps) {
            switch (step.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> { }
            }
        }
        int finished = completed + failed + skipped;
        int percent = total == 0 ? 0 : (int) Math.round(finished * 100.0 / total);
        long perStep = total == 0 ? 0 : estimatedDurationMs / total;
        return new TaskProgress(total, completed, failed, skipped, percent,
                (long) (total - finished) * perStep, currentStepId);
    }
}
