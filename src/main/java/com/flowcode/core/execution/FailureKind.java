package com.flowcode.core.execution;

import java.util.Locale;

/**
 * Classification of a step failure, used by the orchestrator's recovery policy.
 */
public enum FailureKind {
    DEPENDENCY_NOT_SATISFIED(false),
    VALIDATION_FAILURE(false),
    PROVIDER_TIMEOUT(true),
    PROVIDER_UNAVAILABLE(true),
    EXECUTION_ERROR(false),
    APPROVAL_REJECTED(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /** Transient failures are retried before they are escalated. */
    public boolean isTransient() {
        return transientFailure;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
