package com.flowcode.core.model;

/**
 * Status of an individual step within a task.
 */
public enum StepStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    SKIPPED,
    WAITING_APPROVAL;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
