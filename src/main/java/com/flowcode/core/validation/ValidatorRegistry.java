package com.flowcode.core.validation;

import com.flowcode.core.metrics.FlowcodeMetrics;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves validator names to implementations and runs an action's rules.
 */
@Service
public class ValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, ActionValidator> validators = new HashMap<>();
    private final FlowcodeMetrics metrics;

    public ValidatorRegistry(List<ActionValidator> validators,
                             @Autowired(required = false) FlowcodeMetrics metrics) {
        for (ActionValidator validator : validators) {
            ActionValidator previous = this.validators.put(validator.name(), validator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate validator name: " + validator.name());
            }
        }
        this.metrics = metrics;
    }

    /**
     * Runs every rule attached to the action. A validator that throws produces a failed result.
     */
    public List<ValidationResult> validateAll(AgentAction action, StepResult result, ExecutionContext context) {
        var results = new ArrayList<ValidationResult>();
        for (ValidationRule rule : action.validation()) {
            ValidationResult outcome = validate(rule, action, result, context);
            results.add(outcome);
            if (metrics != null) {
                metrics.recordValidationResult(rule.validator(), outcome.passed());
            }
            if (!outcome.passed()) {
                log.info("Validation {} ({}) failed for action {}: {}",
                        rule.id(), rule.severity(), action.id(), outcome.message());
            }
        }
        return results;
    }

    private ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                      ExecutionContext context) {
        ActionValidator validator = validators.get(rule.validator());
        if (validator == null) {
            return ValidationResult.fail(rule, "No validator registered as '" + rule.validator() + "'",
                    List.of("Register a validator named " + rule.validator()));
        }
        try {
            return validator.validate(rule, action, result, context);
        } catch (RuntimeException e) {
            log.warn("Validator {} threw while checking action {}: {}", rule.validator(), action.id(),
                    e.getMessage(), e);
            return ValidationResult.fail(rule, "Validator error: " + e.getMessage(), List.of());
        }
    }

    public boolean isRegistered(String name) {
        return validators.containsKey(name);
    }
}
