package com.flowcode.core.validation;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ChangeType;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.FileChange;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
public class ContentQualityValidator implements ActionValidator {

    private static final Pattern CONFLICT_MARKER = Pattern.compile("(?m)^(<{7}|={7}|>{7})( |$)");

    @Override
    public String name() {
        return "quality.content";
    }

    @Override
    public ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                     ExecutionContext context) {
        if (!result.success()) {
            return ValidationResult.fail(rule, "Operation did not succeed", List.of("Inspect the step output"));
        }
        var problems = new ArrayList<String>();
        for (FileChange change : result.changes()) {
            if (change.type() == ChangeType.DELETE) {
                continue;
            }
            if (change.type() == ChangeType.MODIFY && (change.content() == null || change.content().isBlank())) {
                problems.add(change.path() + " was emptied");
            }
            if (change.content() != null && CONFLICT_MARKER.matcher(change.content()).find()) {
                problems.add(change.path() + " contains merge conflict markers");
            }
        }
        if (problems.isEmpty()) {
            return ValidationResult.pass(rule, "Content quality checks passed");
        }
        return ValidationResult.fail(rule, String.join("; ", problems),
                List.of("Review the generated content before committing"));
    }
}
