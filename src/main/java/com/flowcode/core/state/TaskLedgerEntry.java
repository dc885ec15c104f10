package com.flowcode.core.state;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ComplexityLevel;
import com.flowcode.core.model.RiskLevel;
import com.flowcode.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Per-task bookkeeping from which statistics are derived.
 */
public record TaskLedgerEntry(
    String taskId,
    TaskStatus status,
    RiskLevel riskLevel,
    String complexity,
    Instant startedAt,
    Instant finishedAt,
    Long durationMs
) implements Serializable {

    static TaskLedgerEntry from(AgenticTask task) {
        return new TaskLedgerEntry(task.id(), task.status(), task.riskLevel(), complexityOf(task),
                null, null, null).withStatus(task.status());
    }

    static TaskLedgerEntry unknown(String taskId) {
        return new TaskLedgerEntry(taskId, null, null, "unknown", null, null, null);
    }

    TaskLedgerEntry refresh(AgenticTask task) {
        return new TaskLedgerEntry(taskId, task.status(), task.riskLevel(), complexityOf(task),
                startedAt, finishedAt, durationMs).withStatus(task.status());
    }

    TaskLedgerEntry withStatus(TaskStatus newStatus) {
        Instant now = Instant.now();
        Instant started = startedAt;
        Instant finished = finishedAt;
        Long duration = durationMs;
        if (newStatus == TaskStatus.EXECUTING && started == null) {
            started = now;
        }
        if (newStatus != null && newStatus.isTerminal() && finished == null) {
            finished = now;
            duration = started != null ? Duration.between(started, now).toMillis() : 0L;
        }
        if (newStatus != null && !newStatus.isTerminal()) {
            finished = null;
            duration = null;
        }
        return new TaskLedgerEntry(taskId, newStatus, riskLevel, complexity, started, finished, duration);
    }

    private static String complexityOf(AgenticTask task) {
        for (String tag : task.metadata().tags()) {
            for (ComplexityLevel level : ComplexityLevel.values()) {
                if (level.name().toLowerCase(Locale.ROOT).equals(tag)) {
                    return tag;
                }
            }
        }
        return "unknown";
    }
}
