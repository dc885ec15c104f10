package com.flowcode.core.execution;

/**
 * Thrown by capability providers when an action cannot be performed.
 */
public class CapabilityException extends RuntimeException {
    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
