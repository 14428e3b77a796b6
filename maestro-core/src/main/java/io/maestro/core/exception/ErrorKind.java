package io.maestro.core.exception;

/// Classification of every failure the engine can report.
///
/// Structural kinds (`DUPLICATE_IDENTIFIER`, `INVALID_TRANSITION`, `DEPENDENCY_UNMET`) are
/// programmer errors and are thrown straight back to the caller. Execution kinds are recorded on
/// the failing task and retried according to the queue's {@link io.maestro.core.task.RetryPolicy}.
public enum ErrorKind {
    DUPLICATE_IDENTIFIER(false),
    INVALID_TRANSITION(false),
    NO_AGENT_AVAILABLE(true),
    DEPENDENCY_UNMET(false),
    AGENT_NOT_FOUND(false),
    AGENT_NOT_ACTIVE(true),
    ORCHESTRATOR_NOT_RUNNING(false),
    ORCHESTRATOR_STOPPED(false),
    TASK_TIMEOUT(true),
    UNROUTABLE(false),
    /// The agent reported an error or threw while executing.
    AGENT_FAILURE(true),
    /// A withheld task whose dependency ended in terminal failure.
    DEPENDENCY_FAILED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /// Returns whether a task failing with this kind may be re-enqueued.
    ///
    /// @return `true` for execution-level failures
    public boolean isRetryable() {
        return retryable;
    }
}
