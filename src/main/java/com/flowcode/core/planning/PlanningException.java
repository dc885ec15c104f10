package com.flowcode.core.planning;

/**
 * Thrown when a goal cannot be turned into an executable plan.
 */
public class PlanningException extends RuntimeException {
    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
