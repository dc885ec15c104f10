package com.flowcode.core.state;

/**
 * Thrown when the state file cannot be written. The in-memory state is kept and
 * the next save retries the flush.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
