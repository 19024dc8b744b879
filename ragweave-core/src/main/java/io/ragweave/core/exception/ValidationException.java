package io.ragweave.core.exception;

import java.io.Serial;

/// Thrown when a workflow graph, node definition or prompt template is malformed.
///
/// Raised at graph construction time (before any node executes) or by a step
/// whose inputs do not match its template. Never retried.
public class ValidationException extends RagweaveException {

    @Serial private static final long serialVersionUID = -2262614316946383187L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
