package com.flowcode.core.execution;

/**
 * @param kind       failure classification
 * @param message    human-readable reason, shown in task failure reasons
 * @param rolledBack whether file changes were restored from backups
 */
public record StepFailure(FailureKind kind, String message, boolean rolledBack) {}
