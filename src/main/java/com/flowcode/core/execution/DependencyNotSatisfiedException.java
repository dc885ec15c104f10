package com.flowcode.core.execution;

/**
 * Thrown when a step is attempted before its dependencies completed, or twice.
 */
public class DependencyNotSatisfiedException extends RuntimeException {
    public DependencyNotSatisfiedException(String message) {
        super(message);
    }

    public DependencyNotSatisfiedException(String message, Throwable cause) {
        super(message, cause);
    }
}
