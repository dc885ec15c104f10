package com.flowcode.core.state;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.LearningData;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of {@code agent-state.json}. {@code statistics} is written for
 * external readers and recomputed on load.
 */
public record PersistedState(
    int schemaVersion,
    AgenticTask currentTask,
    List<AgenticTask> taskQueue,
    Map<String, AgenticTask> parkedTasks,
    Map<String, List<ExecutionRecord>> executionHistory,
    Map<String, TaskLedgerEntry> taskLedger,
    TaskStatistics statistics,
    Map<String, String> userPreferences,
    List<LearningData> learningData,
    Instant sessionStartTime,
    Instant lastSaveTime
) {
    public static final int CURRENT_SCHEMA = 1;
}
