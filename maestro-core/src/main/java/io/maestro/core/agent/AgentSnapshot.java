package io.maestro.core.agent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Read-only projection of a registered agent, used by status reports and gateway resources.
///
/// @param id agent identifier
/// @param name display name
/// @param type category tag
/// @param description free text description
/// @param capabilities declared capabilities
/// @param priority routing priority, lower wins
/// @param state current operational state
/// @param runningTasks executions currently in progress on this agent
/// @param totalTasks finished executions (completed plus failed)
/// @param completedTasks successful executions
/// @param failedTasks failed executions
/// @param successRate completed share of finished executions, in percent
/// @param avgResponseSeconds mean duration of successful executions
/// @param lastActivity last time the agent started or finished work, may be null
/// @param lastError message of the most recent failure, may be null
/// @param configuration opaque configuration blob
public record AgentSnapshot(
        String id,
        String name,
        String type,
        String description,
        List<String> capabilities,
        int priority,
        AgentState state,
        int runningTasks,
        long totalTasks,
        long completedTasks,
        long failedTasks,
        double successRate,
        double avgResponseSeconds,
        Instant lastActivity,
        String lastError,
        Map<String, Object> configuration) {}
