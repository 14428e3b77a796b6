package io.maestro.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base class for failures surfaced across the engine boundary.
///
/// Every instance carries an {@link ErrorKind} so gateways can map it to a structured error
/// without inspecting the concrete type.
public class OrchestratorException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2281904417356023816L;

    private final ErrorKind kind;

    public OrchestratorException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public OrchestratorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the failure classification.
    ///
    /// @return error kind, never null
    public ErrorKind getKind() {
        return kind;
    }
}
