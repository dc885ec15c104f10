package com.flowcode.core.model;

public enum ChangeType {
    CREATE,
    MODIFY,
    DELETE
}
