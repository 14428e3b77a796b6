package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when no agent is registered under the requested identifier.
public class AgentNotFoundException extends OrchestratorException {

    @Serial private static final long serialVersionUID = -5533800018143448937L;

    public AgentNotFoundException(String message) {
        super(ErrorKind.AGENT_NOT_FOUND, message);
    }
}
