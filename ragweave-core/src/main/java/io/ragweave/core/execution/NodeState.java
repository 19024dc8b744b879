package io.ragweave.core.execution;

import io.ragweave.core.execution.result.NodeFailure;
import java.time.Instant;
import java.util.Objects;

/// Snapshot of one node's progress in a run.
///
/// @param status current status, not null
/// @param output step output, set only when {@link NodeStatus#SUCCEEDED}
/// @param failure failure details, set only when FAILED or SKIPPED
/// @param attempts attempts started so far
/// @param startedAt when the node was dispatched, null while PENDING or if skipped
/// @param finishedAt when the node reached a terminal status, null before that
public record NodeState(
        NodeStatus status,
        Object output,
        NodeFailure failure,
        int attempts,
        Instant startedAt,
        Instant finishedAt) {

    public NodeState {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static NodeState pending() {
        return new NodeState(NodeStatus.PENDING, null, null, 0, null, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
