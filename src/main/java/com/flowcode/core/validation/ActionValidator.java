package com.flowcode.core.validation;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;

/**
 * A stateless check run against the result an action produced.
 * Implementations are looked up by {@link #name()} from {@link ValidationRule#validator()}.
 */
public interface ActionValidator {

    String name();

    ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result, ExecutionContext context);
}
