package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when work is submitted to a stopped orchestrator.
public class OrchestratorNotRunningException extends OrchestratorException {

    @Serial private static final long serialVersionUID = -8071245583350296221L;

    public OrchestratorNotRunningException(String message) {
        super(ErrorKind.ORCHESTRATOR_NOT_RUNNING, message);
    }
}
