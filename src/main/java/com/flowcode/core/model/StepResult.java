package com.flowcode.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of executing an action.
 *
 * @param success     true when the operation succeeded and no blocking validation failed
 * @param output      provider output (report text, command output)
 * @param changes     file-level side effects, with backups for rollback
 * @param validations results of every rule attached to the action
 * @param performance measured cost of the execution
 * @param warnings    non-blocking problems worth surfacing
 * @param nextSteps   suggested follow-up actions
 */
public record StepResult(
    boolean success,
    String output,
    List<FileChange> changes,
    List<ValidationResult> validations,
    PerformanceMetrics performance,
    List<String> warnings,
    List<String> nextSteps
) implements Serializable {

    public StepResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
        validations = validations == null ? List.of() : List.copyOf(validations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        performance = performance == null ? PerformanceMetrics.wallClock(0) : performance;
    }

    public static StepResult succeeded(String output, List<FileChange> changes) {
        return new StepResult(true, output, changes, List.of(), null, List.of(), List.of());
    }

    public static StepResult failed(String output, List<String> warnings) {
        return new StepResult(false, output, List.of(), List.of(), null, warnings, List.of());
    }

    public StepResult withSuccess(boolean success) {
        return new StepResult(success, output, changes, validations, performance, warnings, nextSteps);
    }

    public StepResult withChanges(List<FileChange> changes) {
        return new StepResult(success, output, changes, validations, performance, warnings, nextSteps);
    }

    public StepResult withValidations(List<ValidationResult> validations) {
        return new StepResult(success, output, changes, validations, performance, warnings, nextSteps);
    }

    public StepResult withPerformance(PerformanceMetrics performance) {
        return new StepResult(success, output, changes, validations, performance, warnings, nextSteps);
    }

    public StepResult withWarning(String warning) {
        var all = new ArrayList<>(warnings);
        all.add(warning);
        return new StepResult(success, output, changes, validations, performance, all, nextSteps);
    }

    public StepResult withNextSteps(List<String> nextSteps) {
        return new StepResult(success, output, changes, validations, performance, warnings, nextSteps);
    }
}
