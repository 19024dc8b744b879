package io.ragweave.core.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Cooperative cancellation flag shared by a run's coordinator and workers.
///
/// Cancelling is idempotent: only the first reason is kept and callbacks run
/// once. Callbacks registered after cancellation run immediately. A signal may
/// be shared by several runs; each run removes its callback when it ends.
///
/// {@snippet :
/// CancellationSignal signal = new CancellationSignal();
/// executor.submit(() -> scheduler.run(graph, inputs, config, listener, signal));
/// signal.cancel("user aborted");
/// }
///
/// @implNote Thread-safe.
public final class CancellationSignal {

    private static final Logger logger = Logger.getLogger(CancellationSignal.class.getName());

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /// Requests cancellation.
    ///
    /// @param reason why the run is cancelled, not null
    /// @return true if this call cancelled the signal, false if it was already cancelled
    public boolean cancel(String reason) {
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /// Returns the reason passed to the first {@link #cancel(String)} call.
    ///
    /// @return cancellation reason, or null if not cancelled
    public String getReason() {
        return reason;
    }

    /// Registers a callback to run on cancellation.
    ///
    /// @param callback action to run once, not null
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    /// Unregisters a callback that has not run yet.
    ///
    /// @param callback callback previously passed to {@link #onCancel(Runnable)}, not null
    /// @return true if the callback was registered and is now removed
    public boolean removeOnCancel(Runnable callback) {
        return callbacks.remove(callback);
    }

    int pendingCallbacks() {
        return callbacks.size();
    }

    /// Waits up to `timeout` for cancellation.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if cancelled within the timeout, false if the timeout elapsed
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cancellation callback failed", e);
        }
    }
}
