package io.ragweave.core.execution;

import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans out all execution lifecycle events to an ordered set of delegates.
///
/// All delegates are invoked in declaration order; an exception from one
/// delegate is logged and does not prevent the remaining delegates from
/// receiving the event.
///
/// ### Usage
/// {@snippet :
/// ExecutionListener composite = new CompositeExecutionListener(
///     metricsListener,
///     new LoggingExecutionListener()
/// );
/// scheduler.run(graph, inputs, config, composite);
/// }
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are
/// captured at construction and never mutated.
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(CompositeExecutionListener.class.getName());

    private final List<ExecutionListener> delegates;

    /// Creates a composite listener that dispatches to all provided delegates in order.
    ///
    /// @param delegates listeners to notify; must not be null, elements must not be null
    public CompositeExecutionListener(ExecutionListener... delegates) {
        this.delegates = List.of(delegates);
    }

    @Override
    public void onRunStart(String runId, WorkflowGraph graph) {
        dispatch(d -> d.onRunStart(runId, graph));
    }

    @Override
    public void onNodeStart(String runId, Node node, int attempt) {
        dispatch(d -> d.onNodeStart(runId, node, attempt));
    }

    @Override
    public void onNodeRetry(String runId, Node node, int failedAttempt, Duration delay, String message) {
        dispatch(d -> d.onNodeRetry(runId, node, failedAttempt, delay, message));
    }

    @Override
    public void onNodeComplete(String runId, Node node, Object output) {
        dispatch(d -> d.onNodeComplete(runId, node, output));
    }

    @Override
    public void onNodeFailed(String runId, Node node, NodeFailure failure) {
        dispatch(d -> d.onNodeFailed(runId, node, failure));
    }

    @Override
    public void onNodeSkipped(String runId, Node node, NodeFailure failure) {
        dispatch(d -> d.onNodeSkipped(runId, node, failure));
    }

    @Override
    public void onRunComplete(RunResult result) {
        dispatch(d -> d.onRunComplete(result));
    }

    private void dispatch(Consumer<ExecutionListener> event) {
        for (ExecutionListener delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Execution listener " + delegate.getClass().getName() + " failed",
                        e);
            }
        }
    }
}
