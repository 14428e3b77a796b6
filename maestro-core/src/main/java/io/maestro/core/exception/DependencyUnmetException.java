package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when a task is admitted to the queue before all of its dependencies completed.
public class DependencyUnmetException extends OrchestratorException {

    @Serial private static final long serialVersionUID = -1756321877604316237L;

    public DependencyUnmetException(String message) {
        super(ErrorKind.DEPENDENCY_UNMET, message);
    }
}
