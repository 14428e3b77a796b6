package io.maestro.core.plan;

import io.maestro.core.task.TaskSpec;
import java.util.List;

/// Result of decomposing a goal.
///
/// Task `dependsOn` entries index into {@link #tasks()}, which is in a valid execution order
/// (every task appears after its dependencies).
///
/// @param tasks executable task specs, never null
/// @param unroutablePortions goal portions that produced no task, never null
/// @param requestType category of the first planned task, or `general`
public record Plan(
        List<TaskSpec> tasks, List<UnroutablePortion> unroutablePortions, String requestType) {

    public static final String GENERAL = "general";

    public Plan {
        tasks = List.copyOf(tasks);
        unroutablePortions = List.copyOf(unroutablePortions);
        requestType = requestType != null ? requestType : GENERAL;
    }

    /// Returns whether nothing in the goal can be executed.
    public boolean isUnroutable() {
        return tasks.isEmpty();
    }

    public boolean isPartial() {
        return !tasks.isEmpty() && !unroutablePortions.isEmpty();
    }
}
