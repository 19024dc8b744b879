package io.ragweave.core.execution;

import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Mutable per-run record of every node's {@link NodeState}.
///
/// ### Contracts
/// - **Invariant**: once a node is SUCCEEDED, FAILED or SKIPPED its state never
///   changes; a further write raises {@link IllegalStateException}
/// - **Invariant**: initial inputs are read-only
///
/// @implNote **Not thread-safe**. Owned by the scheduler's coordinating thread,
/// which is the only writer. Other threads see immutable {@link #snapshot()}s.
///
/// @see WorkflowScheduler
public final class ExecutionContext {

    private final String runId;
    private final String workflowId;
    private final Map<String, Object> initialInputs;
    private final Map<String, NodeState> states = new LinkedHashMap<>();

    /// Creates a context with every node PENDING.
    ///
    /// @param runId unique id of the run, not null
    /// @param graph graph being executed, not null
    /// @param initialInputs run inputs, not null
    public ExecutionContext(String runId, WorkflowGraph graph, Map<String, Object> initialInputs) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.workflowId = graph.getId();
        this.initialInputs =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNull(initialInputs, "initialInputs must not be null")));
        graph.getNodeIds().forEach(id -> states.put(id, NodeState.pending()));
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /// Returns the run inputs.
    ///
    /// @return unmodifiable input map, never null
    public Map<String, Object> getInitialInputs() {
        return initialInputs;
    }

    /// Returns the current state of a node.
    ///
    /// @param nodeId node id, not null
    /// @return node state, never null
    /// @throws IllegalArgumentException if the node is not part of the run
    public NodeState state(String nodeId) {
        NodeState state = states.get(nodeId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeId + "' in run " + runId);
        }
        return state;
    }

    public NodeStatus status(String nodeId) {
        return state(nodeId).status();
    }

    /// Marks a node as dispatched.
    ///
    /// @throws IllegalStateException if the node is not PENDING
    public void markRunning(String nodeId, Instant now) {
        NodeState current = state(nodeId);
        if (current.status() != NodeStatus.PENDING) {
            throw new IllegalStateException(
                    "Node '" + nodeId + "' cannot start from status " + current.status());
        }
        states.put(nodeId, new NodeState(NodeStatus.RUNNING, null, null, 0, now, null));
    }

    /// Records the start of an attempt.
    ///
    /// @throws IllegalStateException if the node is terminal or was never dispatched
    public void markAttemptStarted(String nodeId, int attempt) {
        NodeState current = requireActive(nodeId);
        states.put(
                nodeId,
                new NodeState(NodeStatus.RUNNING, null, null, attempt, current.startedAt(), null));
    }

    /// Records that a node is suspended between attempts.
    ///
    /// @throws IllegalStateException if the node is terminal or was never dispatched
    public void markAwaitingRetry(String nodeId, int attemptsSoFar) {
        NodeState current = requireActive(nodeId);
        states.put(
                nodeId,
                new NodeState(
                        NodeStatus.AWAITING_RETRY, null, null, attemptsSoFar, current.startedAt(), null));
    }

    /// Records a successful result.
    ///
    /// @throws IllegalStateException if the node is already terminal
    public void markSucceeded(String nodeId, Object output, int attempts, Instant now) {
        NodeState current = requireNotTerminal(nodeId);
        states.put(
                nodeId,
                new NodeState(NodeStatus.SUCCEEDED, output, null, attempts, current.startedAt(), now));
    }

    /// Records a failed result.
    ///
    /// @throws IllegalStateException if the node is already terminal
    public void markFailed(String nodeId, NodeFailure failure, Instant now) {
        NodeState current = requireNotTerminal(nodeId);
        states.put(
                nodeId,
                new NodeState(
                        NodeStatus.FAILED, null, failure, failure.attempts(), current.startedAt(), now));
    }

    /// Records that a node will not run (or not finish).
    ///
    /// @throws IllegalStateException if the node is already terminal
    public void markSkipped(String nodeId, NodeFailure failure, Instant now) {
        NodeState current = requireNotTerminal(nodeId);
        states.put(
                nodeId,
                new NodeState(
                        NodeStatus.SKIPPED, null, failure, current.attempts(), current.startedAt(), now));
    }

    public boolean isTerminal(String nodeId) {
        return status(nodeId).isTerminal();
    }

    public boolean allTerminal() {
        return states.values().stream().allMatch(NodeState::isTerminal);
    }

    /// Returns the ids of nodes in a terminal status.
    ///
    /// @return terminal node ids in declaration order, never null
    public Set<String> terminalIds() {
        Set<String> ids = new LinkedHashSet<>();
        states.forEach((id, s) -> {
            if (s.isTerminal()) ids.add(id);
        });
        return ids;
    }

    /// Returns the ids of nodes that have left PENDING.
    ///
    /// @return started node ids in declaration order, never null
    public Set<String> startedIds() {
        Set<String> ids = new LinkedHashSet<>();
        states.forEach((id, s) -> {
            if (s.status() != NodeStatus.PENDING) ids.add(id);
        });
        return ids;
    }

    /// Returns the outputs of succeeded nodes.
    ///
    /// @return node id to output in declaration order, never null
    public Map<String, Object> outputs() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        states.forEach((id, s) -> {
            if (s.status() == NodeStatus.SUCCEEDED) outputs.put(id, s.output());
        });
        return outputs;
    }

    /// Returns an immutable copy of every node state.
    ///
    /// @return node id to state in declaration order, never null
    public Map<String, NodeState> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    private NodeState requireNotTerminal(String nodeId) {
        NodeState current = state(nodeId);
        if (current.isTerminal()) {
            throw new IllegalStateException(
                    "Node '" + nodeId + "' is already terminal with status " + current.status());
        }
        return current;
    }

    private NodeState requireActive(String nodeId) {
        NodeState current = requireNotTerminal(nodeId);
        if (current.status() == NodeStatus.PENDING) {
            throw new IllegalStateException("Node '" + nodeId + "' has not been dispatched");
        }
        return current;
    }
}
