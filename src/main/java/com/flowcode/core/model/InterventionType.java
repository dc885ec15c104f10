package com.flowcode.core.model;

/**
 * Out-of-band control signals a human can send to a running task.
 */
public enum InterventionType {
    PAUSE,
    MODIFY,
    CANCEL,
    REDIRECT
}
