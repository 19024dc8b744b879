package io.ragweave.core.exception;

import java.io.Serial;

/// Base class for all classified engine failures.
///
/// Each subclass carries a fixed {@link ErrorKind} so the node runner can decide
/// between retrying and failing the node without inspecting messages.
///
/// @see ValidationException
/// @see TransientException
/// @see AdapterException
/// @see BudgetExceededException
public abstract class RagweaveException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3187705520447861309L;

    protected RagweaveException(String message) {
        super(message);
    }

    protected RagweaveException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Returns the classification of this failure.
    ///
    /// @return error kind, never null
    public abstract ErrorKind getKind();
}
