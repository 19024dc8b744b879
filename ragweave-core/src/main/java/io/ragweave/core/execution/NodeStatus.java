package io.ragweave.core.execution;

/// Lifecycle status of a node within one run.
///
/// ```
/// PENDING -> RUNNING -> SUCCEEDED
///               |  ^
///               v  |
///         AWAITING_RETRY
///               |
///               v
///            FAILED
/// PENDING -> SKIPPED
/// ```
///
/// Terminal statuses are written once and never change.
public enum NodeStatus {
    PENDING,
    RUNNING,
    AWAITING_RETRY,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
