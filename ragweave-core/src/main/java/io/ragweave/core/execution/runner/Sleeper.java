package io.ragweave.core.execution.runner;

import io.ragweave.core.execution.CancellationSignal;
import java.time.Duration;

/// Waits out a backoff delay while observing run cancellation.
@FunctionalInterface
public interface Sleeper {

    /// Sleeps for `delay` unless the run is cancelled first.
    ///
    /// @param delay time to wait, not null
    /// @param signal run cancellation signal, not null
    /// @return true if the full delay elapsed, false if the run was cancelled
    /// @throws InterruptedException if the sleeping thread is interrupted
    boolean sleep(Duration delay, CancellationSignal signal) throws InterruptedException;

    /// Blocks on the cancellation signal for the delay.
    Sleeper DEFAULT = (delay, signal) -> !signal.awaitCancellation(delay);
}
