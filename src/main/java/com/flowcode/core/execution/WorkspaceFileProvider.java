package com.flowcode.core.execution;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.ChangeType;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.FileChange;
import com.flowcode.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Performs file operations directly on the workspace.
 */
@Component
public class WorkspaceFileProvider implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceFileProvider.class);

    private static final int ANALYSIS_FILE_LIMIT = 500;

    @Override
    public Set<AgentActionType> capabilities() {
        return EnumSet.of(AgentActionType.ANALYZE_CODE, AgentActionType.CREATE_FILE,
                AgentActionType.EDIT_FILE, AgentActionType.DELETE_FILE,
                AgentActionType.GENERATE_DOCUMENTATION);
    }

    @Override
    public StepResult perform(AgentAction action, ExecutionContext context) {
        if (!context.resources().fileSystemAccess()) {
            throw new CapabilityException("File system access is disabled for this task");
        }
        try {
            return switch (action.type()) {
                case ANALYZE_CODE -> analyze(action, context);
                case CREATE_FILE -> create(action, context);
                case EDIT_FILE -> edit(action, context);
                case DELETE_FILE -> delete(action, context);
                case GENERATE_DOCUMENTATION -> document(action, context);
                default -> throw new CapabilityException("Unsupported action type: " + action.type());
            };
        } catch (IOException e) {
            throw new UncheckedIOException("File operation failed for " + action.target(), e);
        }
    }

    private StepResult create(AgentAction action, ExecutionContext context) throws IOException {
        var payload = action.payloadAs(ActionPayload.CreateFile.class);
        Path file = WorkspacePaths.resolve(context.workspaceRoot(), action.target());
        if (Files.exists(file)) {
            throw new CapabilityException("File already exists: " + action.target());
        }
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, payload.content(), StandardCharsets.UTF_8);
        log.info("Created {}", action.target());
        var change = new FileChange(action.target(), ChangeType.CREATE, payload.content(),
                LineDiff.between("", payload.content()), null, false);
        return StepResult.succeeded("Created " + action.target(), List.of(change));
    }

    private StepResult edit(AgentAction action, ExecutionContext context) throws IOException {
        var payload = action.payloadAs(ActionPayload.EditFile.class);
        Path file = WorkspacePaths.resolve(context.workspaceRoot(), action.target());
        if (!Files.isRegularFile(file)) {
            throw new CapabilityException("File not found: " + action.target());
        }
        String before = Files.readString(file, StandardCharsets.UTF_8);
        if (!payload.hasInstructions()) {
            return StepResult.succeeded("No edit instructions for " + action.target(), List.of())
                    .withWarning("Edit of " + action.target() + " had no instructions; file left unchanged");
        }
        String after;
        if (payload.search() == null) {
            after = payload.replacement();
        } else {
            if (!before.contains(payload.search())) {
                throw new CapabilityException("Text to replace not found in " + action.target());
            }
            after = before.replace(payload.search(), payload.replacement());
        }
        Files.writeString(file, after, StandardCharsets.UTF_8);
        log.info("Edited {}", action.target());
        var change = new FileChange(action.target(), ChangeType.MODIFY, after,
                LineDiff.between(before, after), null, false);
        return StepResult.succeeded("Edited " + action.target(), List.of(change));
    }

    private StepResult delete(AgentAction action, ExecutionContext context) throws IOException {
        var changes = new ArrayList<FileChange>();
        for (Path file : WorkspacePaths.affectedFiles(action, context)) {
            if (!Files.isRegularFile(file)) {
                if (Files.isDirectory(file)) {
                    throw new CapabilityException("Refusing to delete directory without a pattern: " + action.target());
                }
                throw new CapabilityException("File not found: " + action.target());
            }
            String relative = WorkspacePaths.relativize(context.workspaceRoot(), file);
            Files.delete(file);
            changes.add(new FileChange(relative, ChangeType.DELETE, null, null, null, false));
        }
        log.info("Deleted {} file(s) for {}", changes.size(), action.id());
        var result = StepResult.succeeded("Deleted " + changes.size() + " file(s)", changes);
        return changes.isEmpty() ? result.withWarning("No files matched " + action.target()) : result;
    }

    private StepResult analyze(AgentAction action, ExecutionContext context) throws IOException {
        Path target = WorkspacePaths.resolve(context.workspaceRoot(), action.target());
        if (!Files.exists(target)) {
            throw new CapabilityException("File not found: " + action.target());
        }
        var report = new StringBuilder();
        int files = 0;
        long lines = 0;
        var largeFiles = new ArrayList<String>();
        for (Path file : sourceFiles(target, context)) {
            files++;
            long count = countLines(file);
            lines += count;
            if (count > 300) {
                largeFiles.add(WorkspacePaths.relativize(context.workspaceRoot(), file) + " (" + count + " lines)");
            }
        }
        report.append("Analyzed ").append(files).append(" file(s), ").append(lines).append(" line(s)");
        var result = StepResult.succeeded(report.toString(), List.of());
        if (!largeFiles.isEmpty()) {
            result = result.withNextSteps(largeFiles.stream().map(f -> "Consider splitting " + f).toList());
        }
        return result;
    }

    private StepResult document(AgentAction action, ExecutionContext context) throws IOException {
        Path target = WorkspacePaths.resolve(context.workspaceRoot(), action.target());
        if (!Files.exists(target)) {
            throw new CapabilityException("File not found: " + action.target());
        }
        var doc = new StringBuilder("# Overview of ").append(action.target()).append("\n\n");
        for (Path file : sourceFiles(target, context)) {
            doc.append("- `").append(WorkspacePaths.relativize(context.workspaceRoot(), file)).append("`\n");
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (trimmed.startsWith("export ") || trimmed.startsWith("public ") || trimmed.startsWith("def ")) {
                    doc.append("  - ").append(trimmed.replaceAll("\\s*\\{\\s*$", "")).append('\n');
                }
            }
        }
        return StepResult.succeeded(doc.toString(), List.of());
    }

    private List<Path> sourceFiles(Path target, ExecutionContext context) throws IOException {
        if (Files.isRegularFile(target)) {
            return List.of(target);
        }
        var restricted = context.constraints().restrictedPaths();
        try (Stream<Path> walk = Files.walk(target)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        for (Path segment : target.relativize(p)) {
                            if (restricted.contains(segment.toString()) || segment.toString().startsWith(".")) {
                                return false;
                            }
                        }
                        return true;
                    })
                    .sorted()
                    .limit(ANALYSIS_FILE_LIMIT)
                    .toList();
        }
    }

    private static long countLines(Path file) {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.count();
        } catch (IOException | UncheckedIOException e) {
            // binary or undecodable content
            return 0;
        }
    }
}
