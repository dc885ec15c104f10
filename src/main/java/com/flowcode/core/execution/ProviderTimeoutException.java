package com.flowcode.core.execution;

/**
 * Thrown when a capability provider does not finish within the step timeout.
 */
public class ProviderTimeoutException extends RuntimeException {
    public ProviderTimeoutException(String message) {
        super(message);
    }

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
