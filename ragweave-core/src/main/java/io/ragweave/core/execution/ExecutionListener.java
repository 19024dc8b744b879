package io.ragweave.core.execution;

import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Duration;

/// Listener for run and node lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onRunStart(runId, graph)
///   onNodeStart(runId, node, attempt)        once per attempt
///   onNodeRetry(runId, node, attempt, ...)   after a transient failure
///   onNodeComplete(runId, node, output)      OR
///   onNodeFailed(runId, node, failure)       OR
///   onNodeSkipped(runId, node, failure)
/// onRunComplete(result)
/// ```
///
/// @implNote Callbacks are invoked on the scheduler's coordinating thread, one
/// at a time per run. A listener shared across concurrent runs must be
/// thread-safe.
///
/// @see WorkflowScheduler
/// @see CompositeExecutionListener
/// @see LoggingExecutionListener
public interface ExecutionListener {

    /// Called once before any node is dispatched.
    ///
    /// @param runId run id, not null
    /// @param graph graph being executed, not null
    default void onRunStart(String runId, WorkflowGraph graph) {}

    /// Called when an attempt of a node starts.
    ///
    /// @param runId run id, not null
    /// @param node node being executed, not null
    /// @param attempt 1-based attempt number
    default void onNodeStart(String runId, Node node, int attempt) {}

    /// Called when a transient failure will be retried after a delay.
    ///
    /// @param runId run id, not null
    /// @param node node being retried, not null
    /// @param failedAttempt the attempt that failed
    /// @param delay backoff before the next attempt, not null
    /// @param message failure message, not null
    default void onNodeRetry(String runId, Node node, int failedAttempt, Duration delay, String message) {}

    /// Called when a node succeeds.
    ///
    /// @param runId run id, not null
    /// @param node completed node, not null
    /// @param output step output, may be null
    default void onNodeComplete(String runId, Node node, Object output) {}

    /// Called when a node fails terminally or exhausts its retries.
    ///
    /// @param runId run id, not null
    /// @param node failed node, not null
    /// @param failure failure details, not null
    default void onNodeFailed(String runId, Node node, NodeFailure failure) {}

    /// Called when a node is skipped without (or before finishing) execution.
    ///
    /// @param runId run id, not null
    /// @param node skipped node, not null
    /// @param failure reason for skipping, not null
    default void onNodeSkipped(String runId, Node node, NodeFailure failure) {}

    /// Called once after every node is terminal.
    ///
    /// @param result run result, not null
    default void onRunComplete(RunResult result) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
