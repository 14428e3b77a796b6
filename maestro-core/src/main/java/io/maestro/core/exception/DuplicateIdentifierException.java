package io.maestro.core.exception;

import java.io.Serial;

/// Thrown when an agent identifier is registered again with a different capability set.
public class DuplicateIdentifierException extends OrchestratorException {

    @Serial private static final long serialVersionUID = -4402967193581234811L;

    public DuplicateIdentifierException(String message) {
        super(ErrorKind.DUPLICATE_IDENTIFIER, message);
    }
}
