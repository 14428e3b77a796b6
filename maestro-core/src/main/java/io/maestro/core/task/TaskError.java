package io.maestro.core.task;

import io.maestro.core.exception.ErrorKind;
import java.time.Instant;
import java.util.Objects;

/// Failure recorded against one execution attempt of a task.
///
/// @param kind failure classification, not null
/// @param message human-readable description, not null
/// @param agentId agent that was executing, may be null when no agent was assigned
/// @param occurredAt when the failure was recorded, not null
public record TaskError(ErrorKind kind, String message, String agentId, Instant occurredAt) {

    public TaskError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : kind.name();
        occurredAt = occurredAt != null ? occurredAt : Instant.now();
    }

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, null, Instant.now());
    }

    public static TaskError of(ErrorKind kind, String message, String agentId) {
        return new TaskError(kind, message, agentId, Instant.now());
    }
}
