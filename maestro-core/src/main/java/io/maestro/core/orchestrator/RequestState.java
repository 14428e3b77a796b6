package io.maestro.core.orchestrator;

/// Lifecycle of a request record.
public enum RequestState {
    IN_PROGRESS,
    /// Finished with every task completed.
    COMPLETED,
    /// Finished with at least one task that exhausted its retries, or with nothing routable.
    FAILED
}
