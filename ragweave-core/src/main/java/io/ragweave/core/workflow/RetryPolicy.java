package io.ragweave.core.workflow;

import io.ragweave.core.exception.ValidationException;
import java.time.Duration;
import java.util.Objects;

/// Retry settings for transient node failures.
///
/// Attempt `n` (1-based) that fails transiently is followed by a delay drawn
/// uniformly from `[0, min(backoffCap, backoffBase * 2^(n-1))]`.
///
/// @param maxAttempts total attempts including the first, at least 1
/// @param backoffBase delay scale for the first retry, not null, non-negative
/// @param backoffCap upper bound of any single delay, not null, not less than base
public record RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffCap) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5));

    public RetryPolicy {
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(backoffCap, "backoffCap must not be null");
        if (maxAttempts < 1) {
            throw new ValidationException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffBase.isNegative()) {
            throw new ValidationException("backoffBase must not be negative");
        }
        if (backoffCap.compareTo(backoffBase) < 0) {
            throw new ValidationException("backoffCap must not be less than backoffBase");
        }
    }

    /// Returns a policy that never retries.
    ///
    /// @return single-attempt policy, never null
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public static RetryPolicy of(int maxAttempts, Duration backoffBase, Duration backoffCap) {
        return new RetryPolicy(maxAttempts, backoffBase, backoffCap);
    }
}
