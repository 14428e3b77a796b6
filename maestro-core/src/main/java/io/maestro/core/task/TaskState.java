package io.maestro.core.task;

import java.util.EnumSet;
import java.util.Set;

/// Lifecycle state of a task.
///
/// ### Transition graph
/// ```
/// PENDING -> ROUTED -> RUNNING -> COMPLETED
///    |         |         |
///    +---------+---------+------> FAILED -> PENDING   (retry, only while not terminal)
/// RUNNING -> ROUTED                                    (re-route after agent error)
/// ```
/// `PENDING -> FAILED` is used when routing finds no agent or when a task is aborted before it
/// was dispatched. `COMPLETED` is always terminal; `FAILED` is terminal once retries are
/// exhausted or the failure kind is not retryable (see {@link Task#isTerminal()}).
public enum TaskState {
    PENDING,
    ROUTED,
    RUNNING,
    COMPLETED,
    FAILED;

    /// Returns the states reachable from this one.
    ///
    /// @return successor states, never null
    public Set<TaskState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ROUTED, FAILED);
            case ROUTED -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, ROUTED);
            case COMPLETED -> EnumSet.noneOf(TaskState.class);
            case FAILED -> EnumSet.of(PENDING);
        };
    }

    public boolean canTransitionTo(TaskState target) {
        return successors().contains(target);
    }
}
