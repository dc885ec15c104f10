package com.flowcode.core.model;

public enum ValidationCategory {
    SECURITY,
    QUALITY,
    PERFORMANCE,
    COMPLIANCE
}
