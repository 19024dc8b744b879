package io.ragweave.adapter.langchain4j;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.RagweaveException;
import io.ragweave.core.exception.TransientException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

/// Translates LangChain4j failures into the engine's error classes.
///
/// The whole cause chain is inspected, typed LangChain4j exceptions first,
/// then HTTP status codes, then JDK network exceptions:
///
/// ```
/// Failure                                      Result
/// ---------------------------------------------+------------------------------
/// RateLimitException, HTTP 429                 │ TransientException RATE_LIMITED
/// TimeoutException, HTTP 408, socket timeout   │ TransientException TIMEOUT
/// other RetriableException, HTTP 5xx, I/O      │ TransientException NETWORK
/// AuthenticationException, HTTP 401/403        │ AdapterException UNAUTHORIZED
/// InvalidRequestException, ModelNotFound, 4xx  │ AdapterException INVALID_REQUEST
/// anything else                                │ AdapterException PROVIDER_ERROR
/// ```
final class LangChain4jErrors {

    private static final int MAX_CHAIN = 20;

    private LangChain4jErrors() {}

    /// Classifies a failure raised by a LangChain4j model or store.
    ///
    /// @param provider provider name reported on adapter errors, not null
    /// @param failure the raised exception, not null
    /// @return transient or adapter exception wrapping `failure`, never null
    static RagweaveException translate(String provider, Throwable failure) {
        if (failure instanceof RagweaveException ragweaveException) {
            return ragweaveException;
        }
        List<Throwable> chain = causeChain(failure);
        String message = provider + ": " + failure.getMessage();

        for (Throwable cause : chain) {
            if (cause instanceof RateLimitException) {
                return new TransientException(TransientException.Reason.RATE_LIMITED, message, failure);
            }
            if (cause instanceof TimeoutException) {
                return new TransientException(TransientException.Reason.TIMEOUT, message, failure);
            }
            if (cause instanceof AuthenticationException) {
                return new AdapterException(provider, AdapterException.Reason.UNAUTHORIZED, message, failure);
            }
            if (cause instanceof InvalidRequestException || cause instanceof ModelNotFoundException) {
                return new AdapterException(
                        provider, AdapterException.Reason.INVALID_REQUEST, message, failure);
            }
        }

        for (Throwable cause : chain) {
            if (cause instanceof HttpException http) {
                return fromStatus(provider, http.statusCode(), message, failure);
            }
        }

        for (Throwable cause : chain) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return new TransientException(TransientException.Reason.TIMEOUT, message, failure);
            }
            if (cause instanceof RetriableException
                    || cause instanceof IOException
                    || cause instanceof UncheckedIOException) {
                return new TransientException(TransientException.Reason.NETWORK, message, failure);
            }
        }

        return new AdapterException(provider, AdapterException.Reason.PROVIDER_ERROR, message, failure);
    }

    private static RagweaveException fromStatus(
            String provider, int status, String message, Throwable failure) {
        if (status == 429) {
            return new TransientException(TransientException.Reason.RATE_LIMITED, message, failure);
        }
        if (status == 408) {
            return new TransientException(TransientException.Reason.TIMEOUT, message, failure);
        }
        if (status >= 500) {
            return new TransientException(TransientException.Reason.NETWORK, message, failure);
        }
        if (status == 401 || status == 403) {
            return new AdapterException(provider, AdapterException.Reason.UNAUTHORIZED, message, failure);
        }
        if (status >= 400) {
            return new AdapterException(provider, AdapterException.Reason.INVALID_REQUEST, message, failure);
        }
        return new AdapterException(provider, AdapterException.Reason.PROVIDER_ERROR, message, failure);
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CHAIN && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
