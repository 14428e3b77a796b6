package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when an agent or task state change is not permitted by its state graph.
///
/// Also raised for stale completion or failure signals that refer to an execution attempt
/// which is no longer live.
public class InvalidTransitionException extends OrchestratorException {

    @Serial private static final long serialVersionUID = 6120336287164939552L;

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }

    /// Creates an exception describing a rejected `from -> to` move.
    ///
    /// @param entity what is transitioning, e.g. `"task 42"`
    /// @param from current state
    /// @param to requested state
    /// @return new exception, never null
    public static InvalidTransitionException of(String entity, Object from, Object to) {
        return new InvalidTransitionException(
                "Invalid transition for " + entity + ": " + from + " -> " + to);
    }
}
