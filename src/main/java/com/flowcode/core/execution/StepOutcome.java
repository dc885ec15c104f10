package com.flowcode.core.execution;

import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.StepStatus;
import com.flowcode.core.model.TaskStep;

/**
 * What the executor reports back for one step: the updated step snapshot, the
 * result (absent when the step never ran) and the failure, if any.
 */
public record StepOutcome(TaskStep step, StepResult result, StepFailure failure) {

    public boolean succeeded() {
        return step.status() == StepStatus.COMPLETED;
    }

    public boolean awaitingApproval() {
        return step.status() == StepStatus.WAITING_APPROVAL;
    }

    public boolean failed() {
        return failure != null;
    }
}
