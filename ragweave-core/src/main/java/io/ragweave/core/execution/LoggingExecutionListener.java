package io.ragweave.core.execution;

import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Duration;
import java.util.logging.Logger;

/// Writes one log line per lifecycle event.
///
/// ### Log Format
/// ```
/// [runId] run started: workflow=qa nodes=3
/// [runId] retrieve -> attempt 1
/// [runId] retrieve <- OK
/// [runId] answer retry after attempt 1 in PT0.2S: rate limited
/// [runId] answer <- FAILED (TRANSIENT after 3 attempts): rate limited
/// [runId] publish skipped (DEPENDENCY_FAILED): Dependency 'answer' failed
/// [runId] run finished: PARTIAL in PT1.2S
/// ```
///
/// @apiNote **Side effects**: writes to the `java.util.logging` category
/// `io.ragweave.core.execution.LoggingExecutionListener`; INFO for run and
/// node transitions, WARNING for retries and failures.
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onRunStart(String runId, WorkflowGraph graph) {
        logger.info("[" + runId + "] run started: workflow=" + graph.getId() + " nodes=" + graph.size());
    }

    @Override
    public void onNodeStart(String runId, Node node, int attempt) {
        logger.info("[" + runId + "] " + node.getId() + " -> attempt " + attempt);
    }

    @Override
    public void onNodeRetry(String runId, Node node, int failedAttempt, Duration delay, String message) {
        logger.warning(
                "["
                        + runId
                        + "] "
                        + node.getId()
                        + " retry after attempt "
                        + failedAttempt
                        + " in "
                        + delay
                        + ": "
                        + message);
    }

    @Override
    public void onNodeComplete(String runId, Node node, Object output) {
        logger.info("[" + runId + "] " + node.getId() + " <- OK");
    }

    @Override
    public void onNodeFailed(String runId, Node node, NodeFailure failure) {
        logger.warning(
                "["
                        + runId
                        + "] "
                        + node.getId()
                        + " <- FAILED ("
                        + failure.kind()
                        + " after "
                        + failure.attempts()
                        + " attempts): "
                        + failure.message());
    }

    @Override
    public void onNodeSkipped(String runId, Node node, NodeFailure failure) {
        logger.warning(
                "[" + runId + "] " + node.getId() + " skipped (" + failure.kind() + "): " + failure.message());
    }

    @Override
    public void onRunComplete(RunResult result) {
        logger.info("[" + result.runId() + "] run finished: " + result.status() + " in " + result.elapsed());
    }
}
