package io.ragweave.core.execution.result;

/// Overall outcome of a run.
public enum RunStatus {
    /// Every node succeeded.
    SUCCESS,
    /// At least one node succeeded and at least one failed or was skipped.
    PARTIAL,
    /// No node succeeded.
    FAILED
}
