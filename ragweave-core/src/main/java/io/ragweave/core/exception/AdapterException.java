package io.ragweave.core.exception;

import java.io.Serial;

/// Thrown for non-transient provider failures. Terminal for the node.
public class AdapterException extends RagweaveException {

    @Serial private static final long serialVersionUID = -4420158637061727120L;

    /// Cause of a provider failure.
    public enum Reason {
        UNAUTHORIZED,
        MALFORMED_RESPONSE,
        INVALID_REQUEST,
        PROVIDER_ERROR
    }

    private final String provider;
    private final Reason reason;

    public AdapterException(String provider, Reason reason, String message) {
        super(message);
        this.provider = provider;
        this.reason = reason;
    }

    public AdapterException(String provider, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.reason = reason;
    }

    /// Returns the name of the provider that failed.
    ///
    /// @return provider name (e.g. "openai", "in-memory"), never null
    public String getProvider() {
        return provider;
    }

    /// Returns why the provider call failed.
    ///
    /// @return failure reason, never null
    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.ADAPTER;
    }
}
