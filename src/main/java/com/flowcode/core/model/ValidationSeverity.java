package com.flowcode.core.model;

/**
 * Only {@code ERROR} failures reject a step result; the others are reported as warnings.
 */
public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO
}
