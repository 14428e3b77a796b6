package io.maestro.core.task;

import java.time.Instant;
import java.util.Objects;

/// Task lifecycle notification.
///
/// @param type what happened, not null
/// @param requestId owning request, not null
/// @param task task state after the change; null for {@link Type#REQUEST_COMPLETED}
/// @param timestamp when the event was emitted, not null
public record TaskEvent(Type type, String requestId, TaskSnapshot task, Instant timestamp) {

    public enum Type {
        ENQUEUED,
        ROUTED,
        RUNNING,
        COMPLETED,
        /// A failed attempt; {@link TaskSnapshot#terminal()} tells whether a retry follows.
        FAILED,
        RETRY_SCHEDULED,
        REQUEST_COMPLETED
    }

    public TaskEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static TaskEvent of(Type type, TaskSnapshot task) {
        return new TaskEvent(type, task.requestId(), task, Instant.now());
    }

    public static TaskEvent requestCompleted(String requestId) {
        return new TaskEvent(Type.REQUEST_COMPLETED, requestId, null, Instant.now());
    }

    /// Returns the task id, or null for request-level events.
    public String taskId() {
        return task != null ? task.id() : null;
    }
}
