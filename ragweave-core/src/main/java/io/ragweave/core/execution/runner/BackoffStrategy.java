package io.ragweave.core.execution.runner;

import io.ragweave.core.workflow.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

/// Exponential backoff with full jitter.
///
/// The delay after failed attempt `n` is drawn uniformly from
/// `[0, min(cap, base * 2^(n-1))]` in milliseconds.
///
/// @implNote Thread-safe if the random generator is.
public final class BackoffStrategy {

    private final RandomGenerator random;

    public BackoffStrategy() {
        this(new Random());
    }

    /// Creates a strategy with an explicit source of randomness.
    ///
    /// @param random jitter source, not null
    public BackoffStrategy(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /// Returns the upper bound of the delay after a failed attempt.
    ///
    /// @param policy retry policy, not null
    /// @param failedAttempt 1-based number of the attempt that failed
    /// @return jitter ceiling, never null
    public static Duration ceiling(RetryPolicy policy, int failedAttempt) {
        long baseMillis = policy.backoffBase().toMillis();
        long capMillis = policy.backoffCap().toMillis();
        int exponent = Math.max(0, failedAttempt - 1);
        if (baseMillis == 0) {
            return Duration.ZERO;
        }
        if (exponent >= Long.numberOfLeadingZeros(baseMillis) - 1) {
            return Duration.ofMillis(capMillis);
        }
        return Duration.ofMillis(Math.min(capMillis, baseMillis << exponent));
    }

    /// Draws the delay before the next attempt.
    ///
    /// @param policy retry policy, not null
    /// @param failedAttempt 1-based number of the attempt that failed
    /// @return delay in `[0, ceiling]`, never null
    public Duration delay(RetryPolicy policy, int failedAttempt) {
        long ceilingMillis = ceiling(policy, failedAttempt).toMillis();
        if (ceilingMillis == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(random.nextLong(ceilingMillis + 1));
    }
}
