package io.maestro.core.orchestrator;

import io.maestro.core.exception.ErrorKind;
import io.maestro.core.plan.UnroutablePortion;
import java.util.List;
import java.util.Objects;

/// Aggregated outcome of a request.
///
/// Every call into the engine ends in one of these; execution failures are described here
/// rather than thrown.
///
/// @param requestId request identifier, null for rejected requests
/// @param goal the caller's goal
/// @param status overall status, not null
/// @param requestType category of the first planned task, or `general`
/// @param complexity `simple`, `medium` or `complex` by task count
/// @param outputs outputs of completed tasks in plan order, never null
/// @param failures terminally failed tasks in plan order, never null
/// @param unroutablePortions goal portions that produced no task, never null
/// @param errorKind top-level error for rejected requests, null otherwise
/// @param message top-level error description, null unless rejected
/// @param durationMillis wall time from submission to completion
public record RequestResult(
        String requestId,
        String goal,
        Status status,
        String requestType,
        String complexity,
        List<TaskOutput> outputs,
        List<TaskFailure> failures,
        List<UnroutablePortion> unroutablePortions,
        ErrorKind errorKind,
        String message,
        long durationMillis) {

    public enum Status {
        /// Every planned task completed and the whole goal was routable.
        SUCCESS,
        /// Some tasks failed or some portions were unroutable; outputs of completed tasks are
        /// still included.
        PARTIAL_FAILURE,
        /// No portion of the goal could be planned.
        UNROUTABLE,
        /// The engine refused the request (e.g. not running).
        REJECTED
    }

    public RequestResult {
        Objects.requireNonNull(status, "status must not be null");
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        unroutablePortions =
                unroutablePortions != null ? List.copyOf(unroutablePortions) : List.of();
    }

    /// Creates a structured top-level error result.
    ///
    /// @param goal the caller's goal, may be null
    /// @param kind error classification, not null
    /// @param message description, not null
    /// @return rejected result, never null
    public static RequestResult rejected(String goal, ErrorKind kind, String message) {
        return new RequestResult(
                null,
                goal,
                Status.REJECTED,
                null,
                null,
                List.of(),
                List.of(),
                List.of(),
                kind,
                message,
                0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /// Classifies a request by its task count.
    ///
    /// @param taskCount number of planned tasks
    /// @return `simple` up to 2, `medium` up to 5, `complex` beyond
    public static String complexityOf(int taskCount) {
        if (taskCount <= 2) {
            return "simple";
        }
        return taskCount <= 5 ? "medium" : "complex";
    }
}
