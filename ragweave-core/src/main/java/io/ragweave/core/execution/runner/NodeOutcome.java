package io.ragweave.core.execution.runner;

import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.execution.result.NodeFailure;
import java.util.Objects;

/// Final result of running one node through all its attempts.
///
/// Exactly one of `output` (success) and `failure` is meaningful.
///
/// @param nodeId node id, not null
/// @param output step output on success, may be null
/// @param failure failure details, null on success
/// @param attempts attempts made
public record NodeOutcome(String nodeId, Object output, NodeFailure failure, int attempts) {

    public NodeOutcome {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    public static NodeOutcome success(String nodeId, Object output, int attempts) {
        return new NodeOutcome(nodeId, output, null, attempts);
    }

    public static NodeOutcome failure(String nodeId, ErrorKind kind, String message, int attempts) {
        return new NodeOutcome(nodeId, null, new NodeFailure(nodeId, kind, message, attempts), attempts);
    }

    public static NodeOutcome cancelled(String nodeId, String reason, int attempts) {
        return failure(nodeId, ErrorKind.CANCELLED, reason, attempts);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isCancelled() {
        return failure != null && failure.kind() == ErrorKind.CANCELLED;
    }
}
