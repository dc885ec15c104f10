package com.flowcode.core.execution;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;
import com.flowcode.core.validation.SecretScanValidator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Read-only reviews: security audits, refactoring and optimisation hints, dependency reports.
 * Produces findings and suggested next steps without touching files.
 */
@Component
public class AdvisoryProvider implements CapabilityProvider {

    private static final int FILE_LIMIT = 500;
    private static final Pattern NESTED_LOOP = Pattern.compile(
            "for\\s*\\([^)]*\\)\\s*\\{[^{}]*for\\s*\\(", Pattern.DOTALL);
    private static final Pattern DEPENDENCY_ENTRY = Pattern.compile(
            "\"[@\\w./-]+\"\\s*:\\s*\"[~^]?\\d[^\"]*\"|<artifactId>[^<]+</artifactId>|^[A-Za-z0-9_.-]+[=<>~!]=", Pattern.MULTILINE);

    @Override
    public Set<AgentActionType> capabilities() {
        return EnumSet.of(AgentActionType.VALIDATE_SECURITY, AgentActionType.REFACTOR_CODE,
                AgentActionType.ANALYZE_DEPENDENCIES, AgentActionType.OPTIMIZE_PERFORMANCE);
    }

    @Override
    public StepResult perform(AgentAction action, ExecutionContext context) {
        return switch (action.type()) {
            case VALIDATE_SECURITY -> audit(action, context);
            case REFACTOR_CODE -> refactorHints(action, context);
            case ANALYZE_DEPENDENCIES -> dependencies(action, context);
            case OPTIMIZE_PERFORMANCE -> optimisationHints(action, context);
            default -> throw new CapabilityException("Unsupported action type: " + action.type());
        };
    }

    private StepResult audit(AgentAction action, ExecutionContext context) {
        var payload = action.payloadAs(ActionPayload.ValidateSecurity.class);
        var findings = new ArrayList<String>();
        int scanned = 0;
        for (Path file : files(action, context)) {
            String content = read(file);
            if (content == null) {
                continue;
            }
            scanned++;
            String relative = WorkspacePaths.relativize(context.workspaceRoot(), file);
            if ("quality".equals(payload.scope())) {
                if (content.contains("<<<<<<<")) {
                    findings.add(relative + ": unresolved merge conflict");
                }
            } else {
                for (String finding : SecretScanValidator.scan(content)) {
                    findings.add(relative + ": " + finding);
                }
            }
        }
        String summary = "Checked " + scanned + " file(s) for " + payload.scope() + " issues, "
                + findings.size() + " finding(s)";
        if (!findings.isEmpty() && "security".equals(payload.scope())) {
            return StepResult.failed(summary + "\n" + String.join("\n", findings), findings);
        }
        return StepResult.succeeded(summary, List.of()).withNextSteps(findings);
    }

    private StepResult refactorHints(AgentAction action, ExecutionContext context) {
        var hints = new ArrayList<String>();
        for (Path file : files(action, context)) {
            String content = read(file);
            if (content == null) {
                continue;
            }
            long lines = content.lines().count();
            String relative = WorkspacePaths.relativize(context.workspaceRoot(), file);
            if (lines > 300) {
                hints.add("Split " + relative + " (" + lines + " lines) into smaller units");
            }
            if (content.lines().anyMatch(l -> l.length() > 160)) {
                hints.add("Wrap long lines in " + relative);
            }
        }
        return StepResult.succeeded("Refactoring review found " + hints.size() + " opportunity(ies)", List.of())
                .withNextSteps(hints);
    }

    private StepResult optimisationHints(AgentAction action, ExecutionContext context) {
        var hints = new ArrayList<String>();
        for (Path file : files(action, context)) {
            String content = read(file);
            if (content != null && NESTED_LOOP.matcher(content).find()) {
                hints.add("Nested loops in " + WorkspacePaths.relativize(context.workspaceRoot(), file)
                        + " may be quadratic");
            }
        }
        return StepResult.succeeded("Performance review found " + hints.size() + " hotspot(s)", List.of())
                .withNextSteps(hints);
    }

    private StepResult dependencies(AgentAction action, ExecutionContext context) {
        var payload = action.payloadAs(ActionPayload.AnalyzeDependencies.class);
        Path manifest = WorkspacePaths.resolve(context.workspaceRoot(), payload.manifest());
        if (!Files.isRegularFile(manifest)) {
            throw new CapabilityException("File not found: " + payload.manifest());
        }
        String content = read(manifest);
        long count = content == null ? 0 : DEPENDENCY_ENTRY.matcher(content).results().count();
        return StepResult.succeeded(payload.manifest() + " declares " + count + " dependency entries", List.of());
    }

    private List<Path> files(AgentAction action, ExecutionContext context) {
        Path target = WorkspacePaths.resolve(context.workspaceRoot(), action.target());
        if (Files.isRegularFile(target)) {
            return List.of(target);
        }
        if (!Files.isDirectory(target)) {
            throw new CapabilityException("File not found: " + action.target());
        }
        var restricted = context.constraints().restrictedPaths();
        try (Stream<Path> walk = Files.walk(target)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        for (Path segment : target.relativize(p)) {
                            if (restricted.contains(segment.toString())) {
                                return false;
                            }
                        }
                        return true;
                    })
                    .sorted()
                    .limit(FILE_LIMIT)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + action.target(), e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            // binary file, nothing to review
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
