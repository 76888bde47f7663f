package com.deskmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task runs, used for CLI progress output.
 *
 * @param eventType    event type (e.g. "task.created", "tool.invoked", "verdict.issued")
 * @param taskId       the task this event belongs to
 * @param subtaskIndex the subtask the event relates to (nullable for task-level events)
 * @param payload      arbitrary key-value data associated with the event
 * @param timestamp    when the event occurred
 */
public record DeskmindEvent(
    String eventType,
    String taskId,
    Integer subtaskIndex,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static DeskmindEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new DeskmindEvent(eventType, taskId, null, payload, Instant.now());
    }

    public static DeskmindEvent of(String eventType, String taskId, int subtaskIndex, Map<String, Object> payload) {
        return new DeskmindEvent(eventType, taskId, subtaskIndex, payload, Instant.now());
    }
}
