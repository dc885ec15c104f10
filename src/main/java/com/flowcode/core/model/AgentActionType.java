package com.flowcode.core.model;

import java.util.Locale;

/**
 * The closed set of operations an agent step can perform.
 */
public enum AgentActionType {
    ANALYZE_CODE(false),
    CREATE_FILE(true),
    EDIT_FILE(true),
    DELETE_FILE(true),
    RUN_COMMAND(true),
    VALIDATE_SECURITY(false),
    RUN_TESTS(false),
    COMMIT_CHANGES(true),
    CREATE_BRANCH(true),
    REFACTOR_CODE(true),
    GENERATE_DOCUMENTATION(false),
    ANALYZE_DEPENDENCIES(false),
    OPTIMIZE_PERFORMANCE(true);

    private final boolean mutating;

    AgentActionType(boolean mutating) {
        this.mutating = mutating;
    }

    /** True when the action can change workspace state (files, branches, history). */
    public boolean isMutating() {
        return mutating;
    }

    /** Actions whose file changes need a pre-action backup for rollback. */
    public boolean isFileMutating() {
        return this == CREATE_FILE || this == EDIT_FILE || this == DELETE_FILE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
