package com.flowcode.core.model;

import java.io.Serializable;

/**
 * A declarative check attached to an action.
 *
 * @param id        rule identifier, unique within the action
 * @param category  what aspect the rule guards
 * @param severity  {@link ValidationSeverity#ERROR} failures reject the step result
 * @param validator name of the registered validator that performs the check
 */
public record ValidationRule(
    String id,
    ValidationCategory category,
    ValidationSeverity severity,
    String validator
) implements Serializable {

    public static ValidationRule error(String id, ValidationCategory category, String validator) {
        return new ValidationRule(id, category, ValidationSeverity.ERROR, validator);
    }

    public static ValidationRule warning(String id, ValidationCategory category, String validator) {
        return new ValidationRule(id, category, ValidationSeverity.WARNING, validator);
    }
}
