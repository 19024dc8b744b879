package io.ragweave.core.exception;

/// Classification of a failure as it appears in a run report.
///
/// The first five kinds map one-to-one onto the exception hierarchy rooted at
/// {@link RagweaveException}. The remaining kinds are produced by the scheduler
/// for nodes that never ran to completion.
///
/// @see io.ragweave.core.execution.NodeFailure
public enum ErrorKind {

    /// Malformed graph, dangling dependency or template/placeholder mismatch.
    VALIDATION,

    /// The workflow graph contains a cycle.
    CYCLE_DETECTED,

    /// Timeout, rate limit or transient network fault. Retried per node policy.
    TRANSIENT,

    /// Non-transient provider failure such as an unauthorized call or malformed response.
    ADAPTER,

    /// Prompt assembly cannot satisfy its token budget.
    BUDGET_EXCEEDED,

    /// Node skipped because an upstream node it depends on failed or was skipped.
    DEPENDENCY_FAILED,

    /// Node skipped because the run was cancelled or timed out.
    CANCELLED,

    /// Unexpected exception raised by step code.
    INTERNAL;

    /// Returns whether failures of this kind are retried by the node runner.
    ///
    /// @return true only for {@link #TRANSIENT}
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
