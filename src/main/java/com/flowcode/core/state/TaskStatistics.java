package com.flowcode.core.state;

import java.util.List;
import java.util.Map;

/**
 * Aggregates derived from the task ledger and execution history. Never stored as
 * a source of truth.
 *
 * @param totalTasks             distinct tasks ever made current or given an execution record
 * @param completedTasks         tasks that reached COMPLETED
 * @param failedTasks            tasks that reached FAILED
 * @param cancelledTasks         tasks that reached CANCELLED
 * @param averageDurationMs      mean duration of finished tasks
 * @param successRate            completed / (completed + failed), 0 when nothing finished
 * @param mostCommonActions      up to five action types, most executed first
 * @param riskDistribution       task count per risk level
 * @param complexityDistribution task count per complexity level
 */
public record TaskStatistics(
    int totalTasks,
    int completedTasks,
    int failedTasks,
    int cancelledTasks,
    double averageDurationMs,
    double successRate,
    List<String> mostCommonActions,
    Map<String, Integer> riskDistribution,
    Map<String, Integer> complexityDistribution
) {
    public TaskStatistics {
        mostCommonActions = List.copyOf(mostCommonActions);
        riskDistribution = Map.copyOf(riskDistribution);
        complexityDistribution = Map.copyOf(complexityDistribution);
    }

    public static TaskStatistics empty() {
        return new TaskStatistics(0, 0, 0, 0, 0.0, 0.0, List.of(), Map.of(), Map.of());
    }
}
