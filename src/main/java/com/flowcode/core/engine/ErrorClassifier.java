package com.flowcode.core.engine;

import com.flowcode.core.execution.DependencyNotSatisfiedException;
import com.flowcode.core.execution.FailureKind;
import com.flowcode.core.execution.ProviderTimeoutException;
import com.flowcode.core.execution.ProviderUnavailableException;
import org.springframework.stereotype.Component;

/**
 * Splits step failures into transient ones, retried automatically, and structural
 * ones, which go to a human.
 */
@Component
public class ErrorClassifier {

    public enum Recovery {
        RETRY,
        ESCALATE
    }

    public FailureKind classify(Throwable error) {
        if (error instanceof ProviderTimeoutException) {
            return FailureKind.PROVIDER_TIMEOUT;
        }
        if (error instanceof ProviderUnavailableException) {
            return FailureKind.PROVIDER_UNAVAILABLE;
        }
        if (error instanceof DependencyNotSatisfiedException) {
            return FailureKind.DEPENDENCY_NOT_SATISFIED;
        }
        return FailureKind.EXECUTION_ERROR;
    }

    /**
     * Transient failures are retried until {@code retriesUsed} reaches {@code retryBound};
     * after that, and for every structural failure, the issue is escalated.
     */
    public Recovery recoveryFor(FailureKind kind, int retriesUsed, int retryBound) {
        if (kind.isTransient() && retriesUsed < retryBound) {
            return Recovery.RETRY;
        }
        return Recovery.ESCALATE;
    }
}
