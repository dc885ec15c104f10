package com.flowcode.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted during task execution, consumed by the CLI and any status reader.
 *
 * @param eventType dotted type, category first (e.g. "task.planned", "step.completed", "approval.requested")
 * @param taskId    the task this event belongs to, null for store-wide events
 * @param stepId    the step this event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FlowcodeEvent(
    String eventType,
    String taskId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    private static final Set<String> TASK_OUTCOMES = Set.of("task.completed", "task.failed", "task.cancelled");

    public static FlowcodeEvent of(String eventType, String taskId, String stepId, Map<String, Object> payload) {
        return new FlowcodeEvent(eventType, taskId, stepId, payload, Instant.now());
    }

    public boolean belongsTo(String id) {
        return taskId != null && taskId.equals(id);
    }

    /** The part of the type before the first dot: "task", "step", "approval", "state". */
    public String category() {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }

    /** True for the event that reports a task reaching a terminal status. */
    public boolean isTaskOutcome() {
        return TASK_OUTCOMES.contains(eventType);
    }
}
