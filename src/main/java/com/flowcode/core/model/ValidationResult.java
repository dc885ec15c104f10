package com.flowcode.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a single {@link ValidationRule} check.
 */
public record ValidationResult(
    ValidationRule rule,
    boolean passed,
    String message,
    List<String> suggestions
) implements Serializable {

    public ValidationResult {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationResult pass(ValidationRule rule, String message) {
        return new ValidationResult(rule, true, message, List.of());
    }

    public static ValidationResult fail(ValidationRule rule, String message, List<String> suggestions) {
        return new ValidationResult(rule, false, message, suggestions);
    }

    /** A failed check that rejects the whole step result. */
    @JsonIgnore
    public boolean isBlocking() {
        return !passed && rule.severity() == ValidationSeverity.ERROR;
    }
}
