package io.ragweave.core.execution.runner;

import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.exception.RagweaveException;
import io.ragweave.core.exception.StepHandlerNotFound;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/// Maps exceptions thrown by step code to an {@link ErrorKind}.
///
/// | Exception | Kind |
/// |---|---|
/// | {@link RagweaveException} | its own kind |
/// | {@link IOException}, {@link UncheckedIOException} | TRANSIENT |
/// | {@link StepHandlerNotFound} | VALIDATION |
/// | anything else | INTERNAL |
///
/// Wrapping {@link ExecutionException}s and {@link CompletionException}s are
/// unwrapped first.
public final class FailureClassifier {

    private FailureClassifier() {}

    public static ErrorKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof RagweaveException re) {
            return re.getKind();
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return ErrorKind.TRANSIENT;
        }
        if (cause instanceof StepHandlerNotFound) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.INTERNAL;
    }

    /// Returns a message for the failure report.
    ///
    /// @param failure the failure, not null
    /// @return the exception message, or its class name when it has none
    public static String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getName();
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
