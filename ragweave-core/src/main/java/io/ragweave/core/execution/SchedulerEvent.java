package io.ragweave.core.execution;

import io.ragweave.core.execution.runner.NodeOutcome;
import java.time.Duration;

/// Messages posted by worker threads to a run's coordinating thread.
sealed interface SchedulerEvent {

    record AttemptStarted(String nodeId, int attempt) implements SchedulerEvent {}

    record RetryScheduled(String nodeId, int failedAttempt, Duration delay, String message)
            implements SchedulerEvent {}

    record NodeFinished(NodeOutcome outcome) implements SchedulerEvent {}

    /// Wakes the coordinator so it re-checks cancellation.
    record Wake() implements SchedulerEvent {}
}
