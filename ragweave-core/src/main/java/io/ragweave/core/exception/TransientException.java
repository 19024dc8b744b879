package io.ragweave.core.exception;

import java.io.Serial;

/// Thrown for failures that may succeed when retried.
///
/// Adapters translate provider timeouts, rate limits and network faults into
/// this type. The node runner also raises it itself when a single attempt
/// exceeds the node timeout.
public class TransientException extends RagweaveException {

    @Serial private static final long serialVersionUID = 1245390981170564412L;

    /// Cause of a transient failure.
    public enum Reason {
        TIMEOUT,
        RATE_LIMITED,
        NETWORK
    }

    private final Reason reason;

    public TransientException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransientException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /// Returns why the call failed.
    ///
    /// @return transient failure reason, never null
    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT;
    }
}
