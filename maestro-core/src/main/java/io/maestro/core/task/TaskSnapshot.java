package io.maestro.core.task;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Immutable view of a task at one point in time; this is what listeners and the record store
/// receive.
///
/// @param id task identifier
/// @param requestId owning request
/// @param index position in the request's plan
/// @param spec what the task does
/// @param state lifecycle state
/// @param terminal whether the task can no longer change state
/// @param assignedAgentId agent currently or last assigned, may be null
/// @param output result payload once completed, may be null
/// @param lastError failure that put the task in `FAILED`, null in any other state
/// @param retryCount retries performed so far
/// @param maxAttempts retries allowed
/// @param attempt execution attempt counter
/// @param dependencyIds task ids this task waits for
/// @param failureHistory every recorded failure, oldest first
/// @param createdAt creation time
/// @param startedAt start of the current or last execution, may be null
/// @param finishedAt time the task reached a terminal state, may be null
/// @param deadline deadline of the current execution, may be null
public record TaskSnapshot(
        String id,
        String requestId,
        int index,
        TaskSpec spec,
        TaskState state,
        boolean terminal,
        String assignedAgentId,
        Map<String, Object> output,
        TaskError lastError,
        int retryCount,
        int maxAttempts,
        int attempt,
        List<String> dependencyIds,
        List<TaskError> failureHistory,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant deadline) {

    public String capability() {
        return spec.capability();
    }

    /// Returns the duration of the last execution.
    ///
    /// @return duration, or null while the task has not finished
    public Duration executionDuration() {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
