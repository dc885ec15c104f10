package com.flowcode.core.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
