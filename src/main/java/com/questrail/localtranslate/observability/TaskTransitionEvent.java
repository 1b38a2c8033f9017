package com.questrail.localtranslate.observability;

import com.questrail.localtranslate.api.TaskId;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one task state change.
 *
 * @param oldState previous state, or {@code null} for a newly submitted task
 * @param attempt  current attempt number (0 before the first attempt)
 * @param detail   free-form context (error kind, delay, reason)
 */
public record TaskTransitionEvent(
    Instant timestamp,
    TaskId taskId,
    TaskState oldState,
    TaskState newState,
    int attempt,
    String detail
) {
    public TaskTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(newState, "newState");
    }
}
