package com.flowcode.core.oversight;

/**
 * A human's choice after automatic recovery for a step is exhausted.
 */
public enum EscalationDecision {
    /** Run the same step again. */
    RETRY,
    /** Mark the step skipped and continue with independent steps. */
    SKIP,
    /** Fail the task. */
    ABORT
}
