package io.ragweave.core.execution.runner;

import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.exception.TransientException;
import io.ragweave.core.execution.CancellationSignal;
import io.ragweave.core.workflow.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs one node's step with a per-attempt timeout and retries.
///
/// ### Attempt Loop
/// 1. Submit the attempt to the executor and wait up to the timeout.
/// 2. On success, return the output.
/// 3. On failure, classify it with {@link FailureClassifier}. Terminal kinds
///    end the node immediately.
/// 4. Retryable kinds are retried after a {@link BackoffStrategy} delay until
///    `maxAttempts` is reached.
///
/// A timed-out attempt is interrupted and counts as a transient
/// {@link TransientException.Reason#TIMEOUT} failure. Cancellation of the run,
/// observed before each attempt, during the backoff sleep, or as an interrupt of
/// the calling thread, ends the node with {@link ErrorKind#CANCELLED}.
///
/// @implNote Thread-safe. Holds no per-node state.
public final class NodeRunner {

    private static final Logger logger = Logger.getLogger(NodeRunner.class.getName());

    private final ExecutorService attemptExecutor;
    private final BackoffStrategy backoff;
    private final Sleeper sleeper;

    public NodeRunner(ExecutorService attemptExecutor) {
        this(attemptExecutor, new BackoffStrategy(), Sleeper.DEFAULT);
    }

    /// Creates a node runner.
    ///
    /// @param attemptExecutor executor on which each attempt runs, not null. The
    ///     calling thread blocks while its attempt runs, so a bounded pool must not
    ///     also be the pool the calling node occupies.
    /// @param backoff delay strategy between attempts, not null
    /// @param sleeper waits out backoff delays, not null
    public NodeRunner(ExecutorService attemptExecutor, BackoffStrategy backoff, Sleeper sleeper) {
        this.attemptExecutor = Objects.requireNonNull(attemptExecutor, "attemptExecutor must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Runs a node until it succeeds, fails terminally, exhausts its retries or
    /// the run is cancelled.
    ///
    /// @param nodeId node id for reporting, not null
    /// @param policy retry policy, not null
    /// @param timeout per-attempt timeout, or null for none
    /// @param step the step to invoke, not null
    /// @param signal run cancellation signal, not null
    /// @param observer attempt progress callback, not null
    /// @return outcome with output or classified failure, never null
    public NodeOutcome run(
            String nodeId,
            RetryPolicy policy,
            Duration timeout,
            StepInvocation step,
            CancellationSignal signal,
            AttemptObserver observer) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(observer, "observer must not be null");

        int attempt = 0;
        while (true) {
            if (signal.isCancelled()) {
                return NodeOutcome.cancelled(nodeId, signal.getReason(), attempt);
            }
            attempt++;
            observer.onAttemptStarted(attempt);
            logger.fine("Node '" + nodeId + "' attempt " + attempt + "/" + policy.maxAttempts());

            try {
                Object output = runAttempt(nodeId, attempt, timeout, step);
                return NodeOutcome.success(nodeId, output, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return NodeOutcome.cancelled(nodeId, cancellationReason(signal), attempt);
            } catch (Exception e) {
                ErrorKind kind = FailureClassifier.classify(e);
                String message = FailureClassifier.describe(e);
                if (!kind.isRetryable()) {
                    logger.log(Level.FINE, "Node '" + nodeId + "' failed terminally: " + message, e);
                    return NodeOutcome.failure(nodeId, kind, message, attempt);
                }
                if (attempt >= policy.maxAttempts()) {
                    logger.fine("Node '" + nodeId + "' exhausted " + attempt + " attempts: " + message);
                    return NodeOutcome.failure(nodeId, kind, message, attempt);
                }

                Duration delay = backoff.delay(policy, attempt);
                observer.onRetryScheduled(attempt, delay, message);
                try {
                    if (!sleeper.sleep(delay, signal)) {
                        return NodeOutcome.cancelled(nodeId, signal.getReason(), attempt);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return NodeOutcome.cancelled(nodeId, cancellationReason(signal), attempt);
                }
            }
        }
    }

    private Object runAttempt(String nodeId, int attempt, Duration timeout, StepInvocation step)
            throws Exception {
        Future<Object> future = attemptExecutor.submit(() -> step.invoke(attempt));
        try {
            return timeout != null
                    ? future.get(timeout.toNanos(), TimeUnit.NANOSECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientException(
                    TransientException.Reason.TIMEOUT,
                    "Node '" + nodeId + "' attempt " + attempt + " timed out after " + timeout,
                    e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (CancellationException e) {
            throw new InterruptedException("Attempt " + attempt + " of node '" + nodeId + "' was cancelled");
        }
    }

    private static String cancellationReason(CancellationSignal signal) {
        return signal.isCancelled() ? signal.getReason() : "Node execution interrupted";
    }
}
