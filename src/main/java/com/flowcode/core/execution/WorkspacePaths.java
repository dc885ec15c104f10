package com.flowcode.core.execution;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves action targets to files inside the workspace.
 */
public final class WorkspacePaths {

    private WorkspacePaths() {}

    /**
     * Resolves a workspace-relative path, refusing anything that escapes the workspace.
     */
    public static Path resolve(Path workspaceRoot, String relativePath) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        Path resolved = root.resolve(relativePath == null || relativePath.isBlank() ? "." : relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new CapabilityException("Path escapes the workspace: " + relativePath);
        }
        return resolved;
    }

    public static String relativize(Path workspaceRoot, Path file) {
        return workspaceRoot.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize())
                .toString().replace('\\', '/');
    }

    /**
     * Files a file-mutating action will touch, in a stable order. Delete actions with
     * a pattern expand the glob below the target directory.
     */
    public static List<Path> affectedFiles(AgentAction action, ExecutionContext context) {
        Path root = context.workspaceRoot();
        return switch (action.type()) {
            case CREATE_FILE, EDIT_FILE -> List.of(resolve(root, action.target()));
            case DELETE_FILE -> {
                var payload = action.payloadAs(ActionPayload.DeleteFile.class);
                Path base = resolve(root, action.target());
                yield payload.pattern().isBlank() ? List.of(base) : matching(base, payload.pattern(), context);
            }
            case RUN_COMMAND -> {
                var payload = action.payloadAs(ActionPayload.RunCommand.class);
                yield payload.mutating()
                        ? payload.affectedPaths().stream().map(p -> resolve(root, p)).toList()
                        : List.of();
            }
            default -> List.of();
        };
    }

    /**
     * Regular files below {@code base} whose relative path matches the glob, skipping restricted paths.
     */
    public static List<Path> matching(Path base, String glob, ExecutionContext context) {
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        PathMatcher nameMatcher = FileSystems.getDefault().getPathMatcher(
                "glob:" + (glob.startsWith("**/") ? glob.substring(3) : glob));
        var restricted = context.constraints().restrictedPaths();
        try (Stream<Path> files = Files.walk(base)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        Path rel = base.relativize(p);
                        return matcher.matches(rel) || nameMatcher.matches(rel);
                    })
                    .filter(p -> !isRestricted(base.relativize(p), restricted))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + base, e);
        }
    }

    private static boolean isRestricted(Path relative, List<String> restricted) {
        for (Path segment : relative) {
            if (restricted.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
