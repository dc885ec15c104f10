package com.flowcode.core.engine;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.TaskStep;

import java.util.Optional;

/**
 * Snapshot of what the orchestrator is doing right now.
 *
 * @param executing   whether a task is being driven by the worker
 * @param currentTask the state store's current task, if any
 * @param currentStep the step being executed or awaiting approval, if any
 */
public record ExecutionStatus(
    boolean executing,
    Optional<AgenticTask> currentTask,
    Optional<TaskStep> currentStep
) {}
