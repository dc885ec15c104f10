package com.flowcode.core.validation;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.FileChange;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.model.ValidationResult;
import com.flowcode.core.model.ValidationRule;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Changes must stay inside the workspace and outside restricted paths.
 * Restricted entries are plain directory names or globs.
 */
@Component
public class PathPolicyValidator implements ActionValidator {

    @Override
    public String name() {
        return "security.paths";
    }

    @Override
    public ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                     ExecutionContext context) {
        var violations = new ArrayList<String>();
        for (FileChange change : result.changes()) {
            String violation = check(change.path(), context);
            if (violation != null) {
                violations.add(violation);
            }
        }
        if (violations.isEmpty()) {
            return ValidationResult.pass(rule, "All changes are inside the workspace");
        }
        return ValidationResult.fail(rule, String.join("; ", violations),
                List.of("Limit changes to writable workspace paths"));
    }

    static String check(String relativePath, ExecutionContext context) {
        Path root = context.workspaceRoot().toAbsolutePath().normalize();
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            return relativePath + " is outside the workspace";
        }
        Path relative = root.relativize(resolved);
        for (String restricted : context.constraints().restrictedPaths()) {
            if (isRestricted(relative, restricted)) {
                return relativePath + " is inside restricted path " + restricted;
            }
        }
        return null;
    }

    private static boolean isRestricted(Path relative, String restricted) {
        if (restricted.contains("*")) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + restricted);
            return matcher.matches(relative);
        }
        for (Path segment : relative) {
            if (segment.toString().equals(restricted)) {
                return true;
            }
        }
        return false;
    }
}
