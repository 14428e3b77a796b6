package io.maestro.core.exception;

import java.io.Serial;

/// Thrown by the router when no active agent declares the required capability.
public class NoAgentAvailableException extends OrchestratorException {

    @Serial private static final long serialVersionUID = 3309128890651727405L;

    public NoAgentAvailableException(String message) {
        super(ErrorKind.NO_AGENT_AVAILABLE, message);
    }
}
