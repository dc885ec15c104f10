package com.flowcode.core.execution;

/**
 * Thrown by capability providers when a backing tool or service is temporarily unavailable.
 * Retried with backoff.
 */
public class ProviderUnavailableException extends RuntimeException {
    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
