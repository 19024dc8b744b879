package io.ragweave.core.execution.result;

import io.ragweave.core.exception.ErrorKind;
import java.util.Objects;

/// Why a node failed or was skipped.
///
/// @param nodeId id of the affected node, not null
/// @param kind classified error kind, not null
/// @param message human-readable cause, not null
/// @param attempts attempts made before giving up, 0 for skipped nodes
public record NodeFailure(String nodeId, ErrorKind kind, String message, int attempts) {

    public NodeFailure {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : kind.name();
    }

    /// Creates the failure recorded for a node that never ran.
    ///
    /// @param nodeId skipped node id, not null
    /// @param kind usually {@link ErrorKind#DEPENDENCY_FAILED} or {@link ErrorKind#CANCELLED}
    /// @param message reason for skipping, not null
    /// @return failure with zero attempts, never null
    public static NodeFailure skipped(String nodeId, ErrorKind kind, String message) {
        return new NodeFailure(nodeId, kind, message, 0);
    }
}
