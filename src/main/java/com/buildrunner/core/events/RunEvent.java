package com.buildrunner.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes.
 *
 * @param eventType one of the constants on {@link RunEvent}, e.g. "task.started"
 * @param runId     the run this event belongs to
 * @param taskName  the task this event relates to (null for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RunEvent(
    String eventType,
    String runId,
    String taskName,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String RUN_STARTED = "run.started";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_BLOCKED = "task.blocked";

    public static RunEvent of(String eventType, String runId, String taskName, Map<String, Object> payload) {
        return new RunEvent(eventType, runId, taskName, payload, Instant.now());
    }
}
