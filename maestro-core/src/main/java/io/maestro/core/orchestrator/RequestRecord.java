package io.maestro.core.orchestrator;

import io.maestro.core.plan.UnroutablePortion;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Durable record of a request, handed to the record store on creation and on completion.
///
/// @param requestId request identifier
/// @param goal the caller's goal
/// @param context caller and record context
/// @param state lifecycle state
/// @param requestType category of the first planned task, or `general`
/// @param taskIds ids of the planned tasks in plan order
/// @param unroutablePortions goal portions that produced no task
/// @param status aggregated status once finished, null while in progress
/// @param createdAt submission time
/// @param finishedAt completion time, null while in progress
public record RequestRecord(
        String requestId,
        String goal,
        Map<String, Object> context,
        RequestState state,
        String requestType,
        List<String> taskIds,
        List<UnroutablePortion> unroutablePortions,
        RequestResult.Status status,
        Instant createdAt,
        Instant finishedAt) {}
