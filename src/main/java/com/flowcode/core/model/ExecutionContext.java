package com.flowcode.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Everything the executor needs to run one step.
 *
 * @param taskId            owning task
 * @param workspaceRoot     absolute workspace directory; all file targets resolve below it
 * @param resources         resource ceilings
 * @param constraints       policy constraints
 * @param completedStepIds  steps already completed, for the dependency pre-flight check
 * @param approvedActionIds actions with an approval on file
 * @param providerRetries   retry bound for transient provider errors
 */
public record ExecutionContext(
    String taskId,
    Path workspaceRoot,
    ResourceLimits resources,
    ExecutionConstraints constraints,
    Set<String> completedStepIds,
    Set<String> approvedActionIds,
    int providerRetries
) {

    public ExecutionContext {
        completedStepIds = completedStepIds == null ? Set.of() : Set.copyOf(completedStepIds);
        approvedActionIds = approvedActionIds == null ? Set.of() : Set.copyOf(approvedActionIds);
    }

    public ExecutionContext withProgress(Set<String> completedStepIds, Set<String> approvedActionIds) {
        return new ExecutionContext(taskId, workspaceRoot, resources, constraints,
                completedStepIds, approvedActionIds, providerRetries);
    }

    public record ResourceLimits(
        long memoryLimitBytes,
        Duration timeLimit,
        boolean networkAccess,
        boolean fileSystemAccess
    ) {
        public static ResourceLimits defaults() {
            return new ResourceLimits(1024L * 1024 * 1024, Duration.ofHours(1), true, true);
        }
    }

    public record ExecutionConstraints(
        long maxFileSizeBytes,
        List<String> restrictedPaths,
        String securityLevel
    ) {
        public ExecutionConstraints {
            restrictedPaths = restrictedPaths == null ? List.of() : List.copyOf(restrictedPaths);
        }

        public static ExecutionConstraints defaults() {
            return new ExecutionConstraints(10L * 1024 * 1024, List.of("node_modules", ".git"), "medium");
        }
    }
}
