package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when an agent exists but is not in the active state.
public class AgentNotActiveException extends OrchestratorException {

    @Serial private static final long serialVersionUID = 7391626551209188434L;

    public AgentNotActiveException(String message) {
        super(ErrorKind.AGENT_NOT_ACTIVE, message);
    }
}
