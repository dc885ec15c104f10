package com.flowcode.core.model;

/**
 * Thrown when a status change is not allowed by the task state machine.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
