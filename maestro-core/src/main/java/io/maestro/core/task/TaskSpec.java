package io.maestro.core.task;

import io.maestro.core.util.Payloads;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// What a task must do, as produced by the planner.
///
/// @param capability required capability, lower-cased, not null
/// @param input payload handed to the agent, never null
/// @param dependsOn indexes of tasks in the same plan that must complete first, never null
/// @param priority dispatch priority, not null
/// @param timeout execution deadline measured from dispatch, null for the configured default
/// @param pinnedAgentId agent that must execute the task, bypassing routing; may be null
/// @param description the goal portion this task was derived from, never null
public record TaskSpec(
        String capability,
        Map<String, Object> input,
        List<Integer> dependsOn,
        TaskPriority priority,
        Duration timeout,
        String pinnedAgentId,
        String description) {

    public TaskSpec {
        Objects.requireNonNull(capability, "capability must not be null");
        capability = capability.toLowerCase(Locale.ROOT);
        input = Payloads.copy(input);
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        priority = priority != null ? priority : TaskPriority.MEDIUM;
        description = description != null ? description : "";
    }

    /// Creates an independent medium-priority spec.
    public static TaskSpec of(String capability, Map<String, Object> input) {
        return new TaskSpec(capability, input, List.of(), TaskPriority.MEDIUM, null, null, "");
    }

    public TaskSpec withDependsOn(List<Integer> indexes) {
        return new TaskSpec(
                capability, input, indexes, priority, timeout, pinnedAgentId, description);
    }

    public TaskSpec withPriority(TaskPriority newPriority) {
        return new TaskSpec(
                capability, input, dependsOn, newPriority, timeout, pinnedAgentId, description);
    }

    public TaskSpec withTimeout(Duration newTimeout) {
        return new TaskSpec(
                capability, input, dependsOn, priority, newTimeout, pinnedAgentId, description);
    }

    public TaskSpec pinnedTo(String agentId) {
        return new TaskSpec(
                capability, input, dependsOn, priority, timeout, agentId, description);
    }
}
