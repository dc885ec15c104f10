package com.flowcode.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an {@link AgenticTask}.
 * <p>
 * {@code PAUSED} is resumable through {@code EXECUTING}; the remaining
 * terminal states never leave.
 */
public enum TaskStatus {
    PLANNING,
    READY,
    EXECUTING,
    WAITING_APPROVAL,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the task state machine permits moving from this status to {@code target}.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case PLANNING -> EnumSet.of(READY, FAILED, CANCELLED);
            case READY -> EnumSet.of(EXECUTING, CANCELLED);
            case EXECUTING -> EnumSet.of(WAITING_APPROVAL, PAUSED, COMPLETED, FAILED, CANCELLED);
            case WAITING_APPROVAL -> EnumSet.of(EXECUTING, PAUSED, FAILED, CANCELLED);
            case PAUSED -> EnumSet.of(EXECUTING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
