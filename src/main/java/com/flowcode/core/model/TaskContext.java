package com.flowcode.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Read-only inputs about the workspace a task runs against.
 *
 * @param workspaceRoot    absolute path of the workspace
 * @param activeFiles      files open or recently touched by the user
 * @param branch           current VCS branch, may be null
 * @param dependencies     declared project dependencies
 * @param architecture     free-form architecture snapshot (e.g., "language" -> "typescript")
 * @param security         free-form security snapshot (e.g., "vulnerableDependencies" -> "2")
 * @param quality          free-form quality snapshot (e.g., "technicalDebtItems" -> "7")
 */
public record TaskContext(
    String workspaceRoot,
    List<String> activeFiles,
    String branch,
    List<String> dependencies,
    Map<String, String> architecture,
    Map<String, String> security,
    Map<String, String> quality
) implements Serializable {

    public TaskContext {
        activeFiles = activeFiles == null ? List.of() : List.copyOf(activeFiles);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        architecture = architecture == null ? Map.of() : Map.copyOf(architecture);
        security = security == null ? Map.of() : Map.copyOf(security);
        quality = quality == null ? Map.of() : Map.copyOf(quality);
    }

    public static TaskContext of(String workspaceRoot) {
        return new TaskContext(workspaceRoot, List.of(), null, List.of(), Map.of(), Map.of(), Map.of());
    }
}
