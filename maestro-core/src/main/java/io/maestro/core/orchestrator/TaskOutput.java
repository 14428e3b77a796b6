package io.maestro.core.orchestrator;

import java.util.Map;

/// Output of one completed task inside a {@link RequestResult}.
///
/// @param taskId task identifier
/// @param index position in the plan
/// @param capability capability the task was routed for
/// @param agentId agent that produced the output
/// @param output result payload
/// @param durationMillis execution time of the successful attempt
public record TaskOutput(
        String taskId,
        int index,
        String capability,
        String agentId,
        Map<String, Object> output,
        long durationMillis) {}
