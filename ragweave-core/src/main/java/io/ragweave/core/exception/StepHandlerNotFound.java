package io.ragweave.core.exception;

import java.io.Serial;

public class StepHandlerNotFound extends Exception {
    @Serial private static final long serialVersionUID = 6092114372870195188L;

    public StepHandlerNotFound(String message) {
        super(message);
    }
}
