package com.flowcode.core.validation;

import com.flowcode.core.config.FlowcodeProperties;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
public class PerformanceBudgetValidator implements ActionValidator {

    private final Duration budget;

    public PerformanceBudgetValidator(FlowcodeProperties properties) {
        this.budget = properties.getExecutor().getPerformanceBudget();
    }

    @Override
    public String name() {
        return "performance.budget";
    }

    @Override
    public ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                     ExecutionContext context) {
        long elapsed = result.performance().executionTimeMs();
        if (elapsed < budget.toMillis()) {
            return ValidationResult.pass(rule, "Executed in " + elapsed + "ms");
        }
        return ValidationResult.fail(rule,
                "Execution took " + elapsed + "ms, budget is " + budget.toMillis() + "ms",
                List.of("Split the action into smaller steps"));
    }
}
