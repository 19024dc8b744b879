package io.ragweave.core.execution.result;

import io.ragweave.core.execution.NodeState;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Result of one workflow run.
///
/// @param runId unique run id, not null
/// @param workflowId id of the executed graph, not null
/// @param status overall outcome, not null
/// @param outputs outputs of succeeded nodes keyed by node id, never null
/// @param failures one entry per failed or skipped node, in declaration order, never null
/// @param snapshot final state of every node, never null
/// @param elapsed wall-clock duration of the run, not null
public record RunResult(
        String runId,
        String workflowId,
        RunStatus status,
        Map<String, Object> outputs,
        List<NodeFailure> failures,
        Map<String, NodeState> snapshot,
        Duration elapsed) {

    public RunResult {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        failures = List.copyOf(failures);
        snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }

    /// Derives the run status from the node outcomes.
    ///
    /// @param succeeded number of succeeded nodes
    /// @param unsuccessful number of failed or skipped nodes
    /// @return SUCCESS, PARTIAL or FAILED
    public static RunStatus statusOf(int succeeded, int unsuccessful) {
        if (unsuccessful == 0) {
            return RunStatus.SUCCESS;
        }
        return succeeded > 0 ? RunStatus.PARTIAL : RunStatus.FAILED;
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    /// Returns the output of a succeeded node cast to the expected type.
    ///
    /// @param nodeId node id, not null
    /// @param type expected output type, not null
    /// @return the output, or empty if the node did not succeed or has another type
    public <T> Optional<T> output(String nodeId, Class<T> type) {
        Object value = outputs.get(nodeId);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /// Returns the failure recorded for a node.
    ///
    /// @param nodeId node id, not null
    /// @return the failure, or empty if the node succeeded
    public Optional<NodeFailure> failure(String nodeId) {
        return failures.stream().filter(f -> f.nodeId().equals(nodeId)).findFirst();
    }
}
