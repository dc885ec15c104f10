package com.flowcode.core.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
