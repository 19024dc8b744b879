package io.ragweave.core.execution.runner;

import java.time.Duration;

/// Receives attempt progress from a {@link NodeRunner}.
///
/// Called on the worker thread running the node.
public interface AttemptObserver {

    void onAttemptStarted(int attempt);

    void onRetryScheduled(int failedAttempt, Duration delay, String message);

    AttemptObserver NOOP =
            new AttemptObserver() {
                @Override
                public void onAttemptStarted(int attempt) {}

                @Override
                public void onRetryScheduled(int failedAttempt, Duration delay, String message) {}
            };
}
