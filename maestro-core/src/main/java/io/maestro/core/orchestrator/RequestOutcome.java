package io.maestro.core.orchestrator;

import java.time.Instant;

/// Summary of a finished request, kept in the status snapshot.
///
/// @param requestId request identifier
/// @param goal the caller's goal
/// @param status aggregated result status
/// @param taskCount number of planned tasks
/// @param failedCount number of failed tasks
/// @param durationMillis wall time from submission to completion
/// @param finishedAt completion time
public record RequestOutcome(
        String requestId,
        String goal,
        RequestResult.Status status,
        int taskCount,
        int failedCount,
        long durationMillis,
        Instant finishedAt) {}
