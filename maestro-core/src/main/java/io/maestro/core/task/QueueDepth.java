package io.maestro.core.task;

/// Task counts per lifecycle position.
///
/// @param pending enqueued and waiting for dispatch
/// @param withheld pending but not yet enqueued because a dependency is not complete
/// @param routed assigned to an agent, not yet running
/// @param running executing on an agent
/// @param retrying failed and waiting for the backoff delay
/// @param completed completed
/// @param failed terminally failed
public record QueueDepth(
        int pending,
        int withheld,
        int routed,
        int running,
        int retrying,
        int completed,
        int failed) {

    public int total() {
        return pending + withheld + routed + running + retrying + completed + failed;
    }

    /// Returns the number of tasks that have not reached a terminal state.
    public int active() {
        return pending + withheld + routed + running + retrying;
    }
}
