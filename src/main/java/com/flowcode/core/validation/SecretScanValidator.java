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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects written content that contains credentials or obviously dangerous code.
 */
@Component
public class SecretScanValidator implements ActionValidator {

    private record SecretPattern(String name, Pattern pattern) {}

    private static final List<SecretPattern> SECRET_PATTERNS = List.of(
            new SecretPattern("API key", Pattern.compile(
                    "(?i)(?:api[_-]?key|apikey)\\s*[:=]\\s*[\"']([a-zA-Z0-9_-]{20,})[\"']")),
            new SecretPattern("AWS access key", Pattern.compile("AKIA[0-9A-Z]{16}")),
            new SecretPattern("GitHub token", Pattern.compile("ghp_[a-zA-Z0-9]{36}")),
            new SecretPattern("OpenAI key", Pattern.compile("sk-[a-zA-Z0-9]{48}")),
            new SecretPattern("Password", Pattern.compile(
                    "(?i)(?:password|pwd|pass)\\s*[:=]\\s*[\"']([^\"']{8,})[\"']")),
            new SecretPattern("Private key", Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----")),
            new SecretPattern("JWT", Pattern.compile(
                    "eyJ[a-zA-Z0-9_-]+\\.eyJ[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+"))
    );

    private static final List<SecretPattern> CODE_PATTERNS = List.of(
            new SecretPattern("eval()", Pattern.compile("\\beval\\s*\\(")),
            new SecretPattern("new Function()", Pattern.compile("\\bnew\\s+Function\\s*\\(")),
            new SecretPattern("innerHTML assignment", Pattern.compile("\\.innerHTML\\s*="))
    );

    /**
     * Names of the secret and unsafe code patterns found in {@code content}.
     */
    public static List<String> scan(String content) {
        var found = new ArrayList<String>();
        for (SecretPattern secret : SECRET_PATTERNS) {
            if (secret.pattern().matcher(content).find()) {
                found.add(secret.name());
            }
        }
        for (SecretPattern code : CODE_PATTERNS) {
            if (code.pattern().matcher(content).find()) {
                found.add("Unsafe " + code.name());
            }
        }
        return found;
    }

    @Override
    public String name() {
        return "security.secrets";
    }

    @Override
    public ValidationResult validate(ValidationRule rule, AgentAction action, StepResult result,
                                     ExecutionContext context) {
        var findings = new LinkedHashSet<String>();
        for (FileChange change : result.changes()) {
            if (change.type() == ChangeType.DELETE || change.content() == null) {
                continue;
            }
            for (String finding : scan(change.content())) {
                findings.add(finding + " in " + change.path());
            }
        }
        if (findings.isEmpty()) {
            return ValidationResult.pass(rule, "No secrets or unsafe code patterns found");
        }
        var suggestions = new ArrayList<String>();
        suggestions.add("Move credentials to environment variables or a secret store");
        suggestions.add("Avoid dynamic code evaluation");
        return ValidationResult.fail(rule, "Security issues found: " + String.join("; ", findings), suggestions);
    }
}
