package com.flowcode.core.validation;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.FileChange;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Component
public class FileSizeComplianceValidator implements ActionValidator {

    @Override
    public String name() {
        return "compliance.file-size";
    }

    @Override
    public ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                     ExecutionContext context) {
        long limit = context.constraints().maxFileSizeBytes();
        var oversized = new ArrayList<String>();
        for (FileChange change : result.changes()) {
            if (change.content() != null
                    && change.content().getBytes(StandardCharsets.UTF_8).length > limit) {
                oversized.add(change.path());
            }
        }
        if (oversized.isEmpty()) {
            return ValidationResult.pass(rule, "All files within " + limit + " bytes");
        }
        return ValidationResult.fail(rule, "Files exceed " + limit + " bytes: " + String.join(", ", oversized),
                List.of("Split large files into smaller modules"));
    }
}
