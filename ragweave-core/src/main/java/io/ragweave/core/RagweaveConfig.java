package io.ragweave.core;

import io.ragweave.core.util.Durations;
import io.ragweave.core.workflow.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Run-level settings for the Ragweave engine.
///
/// Passed into every {@link io.ragweave.core.execution.WorkflowScheduler} run and
/// read by the built-in step handlers. An environment holds a default instance.
///
/// ### Default Values
/// - `maxConcurrentNodes`: `4`
/// - `defaultNodeTimeout`: `30s`
/// - `defaultRetryPolicy`: 3 attempts, 200 ms base, 5 s cap
/// - `defaultCacheTtl`: `10m`
/// - `contextTokenBudget`: `2000`
/// - `minSimilarity`: `0.0`
/// - `retrievalTopK`: `5`
/// - `runTimeout`: none
///
/// ### Property Keys
/// See {@link #fromProperties(Map)}. Durations accept ISO-8601 (`PT30S`) or
/// milliseconds (`30000`).
///
/// @implNote Immutable and thread-safe.
///
/// @see RagweaveFactory.Builder#config(RagweaveConfig)
public final class RagweaveConfig {

    public static final String MAX_CONCURRENT_NODES = "ragweave.scheduler.max-concurrent-nodes";
    public static final String NODE_TIMEOUT = "ragweave.node.timeout";
    public static final String NODE_MAX_ATTEMPTS = "ragweave.node.max-attempts";
    public static final String NODE_BACKOFF_BASE = "ragweave.node.backoff-base";
    public static final String NODE_BACKOFF_CAP = "ragweave.node.backoff-cap";
    public static final String CACHE_TTL = "ragweave.cache.ttl";
    public static final String CONTEXT_TOKEN_BUDGET = "ragweave.retrieval.context-token-budget";
    public static final String MIN_SIMILARITY = "ragweave.retrieval.min-similarity";
    public static final String TOP_K = "ragweave.retrieval.top-k";
    public static final String RUN_TIMEOUT = "ragweave.run.timeout";

    private final int maxConcurrentNodes;
    private final Duration defaultNodeTimeout;
    private final RetryPolicy defaultRetryPolicy;
    private final Duration defaultCacheTtl;
    private final int contextTokenBudget;
    private final double minSimilarity;
    private final int retrievalTopK;
    private final Duration runTimeout;

    private RagweaveConfig(Builder builder) {
        this.maxConcurrentNodes = builder.maxConcurrentNodes;
        this.defaultNodeTimeout =
                Objects.requireNonNull(builder.defaultNodeTimeout, "defaultNodeTimeout must not be null");
        this.defaultRetryPolicy =
                Objects.requireNonNull(builder.defaultRetryPolicy, "defaultRetryPolicy must not be null");
        this.defaultCacheTtl =
                Objects.requireNonNull(builder.defaultCacheTtl, "defaultCacheTtl must not be null");
        this.contextTokenBudget = builder.contextTokenBudget;
        this.minSimilarity = builder.minSimilarity;
        this.retrievalTopK = builder.retrievalTopK;
        this.runTimeout = builder.runTimeout;

        if (maxConcurrentNodes < 1) {
            throw new IllegalArgumentException("maxConcurrentNodes must be at least 1");
        }
        requirePositive(defaultNodeTimeout, "defaultNodeTimeout");
        requirePositive(defaultCacheTtl, "defaultCacheTtl");
        if (runTimeout != null) {
            requirePositive(runTimeout, "runTimeout");
        }
        if (contextTokenBudget < 0) {
            throw new IllegalArgumentException("contextTokenBudget must not be negative");
        }
        if (retrievalTopK < 1) {
            throw new IllegalArgumentException("retrievalTopK must be at least 1");
        }
    }

    /// Returns a configuration with every default applied.
    ///
    /// @return default configuration, never null
    public static RagweaveConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a configuration from string properties.
    ///
    /// Keys not present keep their defaults; unknown keys are ignored.
    ///
    /// @param properties property map, not null
    /// @return parsed configuration, never null
    /// @throws IllegalArgumentException if a present value cannot be parsed
    /// @throws io.ragweave.core.exception.ValidationException if the retry settings are inconsistent
    public static RagweaveConfig fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();
        RetryPolicy defaults = RetryPolicy.DEFAULT;

        read(properties, MAX_CONCURRENT_NODES, Integer::parseInt).ifPresent(builder::maxConcurrentNodes);
        read(properties, NODE_TIMEOUT, Durations::parse).ifPresent(builder::defaultNodeTimeout);
        read(properties, CACHE_TTL, Durations::parse).ifPresent(builder::defaultCacheTtl);
        read(properties, CONTEXT_TOKEN_BUDGET, Integer::parseInt).ifPresent(builder::contextTokenBudget);
        read(properties, MIN_SIMILARITY, Double::parseDouble).ifPresent(builder::minSimilarity);
        read(properties, TOP_K, Integer::parseInt).ifPresent(builder::retrievalTopK);
        read(properties, RUN_TIMEOUT, Durations::parse).ifPresent(builder::runTimeout);

        int maxAttempts = read(properties, NODE_MAX_ATTEMPTS, Integer::parseInt).orElse(defaults.maxAttempts());
        Duration base = read(properties, NODE_BACKOFF_BASE, Durations::parse).orElse(defaults.backoffBase());
        Duration cap = read(properties, NODE_BACKOFF_CAP, Durations::parse).orElse(defaults.backoffCap());
        builder.defaultRetryPolicy(new RetryPolicy(maxAttempts, base, cap));

        return builder.build();
    }

    private static <T> Optional<T> read(
            Map<String, String> properties, String key, Function<String, T> parser) {
        String raw = properties.get(key);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(raw.trim()));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + raw, e);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /// Returns the maximum number of nodes a single run executes at once.
    ///
    /// @return in-flight limit, at least 1
    public int getMaxConcurrentNodes() {
        return maxConcurrentNodes;
    }

    /// Returns the per-attempt timeout for nodes that do not set their own.
    ///
    /// @return node timeout, never null
    public Duration getDefaultNodeTimeout() {
        return defaultNodeTimeout;
    }

    /// Returns the retry policy for nodes that do not set their own.
    ///
    /// @return retry policy, never null
    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    public Duration getDefaultCacheTtl() {
        return defaultCacheTtl;
    }

    public int getContextTokenBudget() {
        return contextTokenBudget;
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public int getRetrievalTopK() {
        return retrievalTopK;
    }

    /// Returns the wall-clock limit of a whole run.
    ///
    /// @return run timeout, or empty for no limit
    public Optional<Duration> getRunTimeout() {
        return Optional.ofNullable(runTimeout);
    }

    /// Returns a builder pre-filled with this configuration.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return builder()
                .maxConcurrentNodes(maxConcurrentNodes)
                .defaultNodeTimeout(defaultNodeTimeout)
                .defaultRetryPolicy(defaultRetryPolicy)
                .defaultCacheTtl(defaultCacheTtl)
                .contextTokenBudget(contextTokenBudget)
                .minSimilarity(minSimilarity)
                .retrievalTopK(retrievalTopK)
                .runTimeout(runTimeout);
    }

    @Override
    public String toString() {
        return "RagweaveConfig{maxConcurrentNodes="
                + maxConcurrentNodes
                + ", defaultNodeTimeout="
                + defaultNodeTimeout
                + ", defaultRetryPolicy="
                + defaultRetryPolicy
                + ", defaultCacheTtl="
                + defaultCacheTtl
                + ", contextTokenBudget="
                + contextTokenBudget
                + ", minSimilarity="
                + minSimilarity
                + ", retrievalTopK="
                + retrievalTopK
                + ", runTimeout="
                + runTimeout
                + "}";
    }

    /// Fluent builder for {@link RagweaveConfig}.
    ///
    /// @implNote **Not thread-safe**. Values are validated in {@link #build()}.
    public static final class Builder {
        private int maxConcurrentNodes = 4;
        private Duration defaultNodeTimeout = Duration.ofSeconds(30);
        private RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;
        private Duration defaultCacheTtl = Duration.ofMinutes(10);
        private int contextTokenBudget = 2000;
        private double minSimilarity = 0.0;
        private int retrievalTopK = 5;
        private Duration runTimeout;

        private Builder() {}

        public Builder maxConcurrentNodes(int maxConcurrentNodes) {
            this.maxConcurrentNodes = maxConcurrentNodes;
            return this;
        }

        public Builder defaultNodeTimeout(Duration defaultNodeTimeout) {
            this.defaultNodeTimeout = defaultNodeTimeout;
            return this;
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder defaultCacheTtl(Duration defaultCacheTtl) {
            this.defaultCacheTtl = defaultCacheTtl;
            return this;
        }

        public Builder contextTokenBudget(int contextTokenBudget) {
            this.contextTokenBudget = contextTokenBudget;
            return this;
        }

        public Builder minSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
            return this;
        }

        public Builder retrievalTopK(int retrievalTopK) {
            this.retrievalTopK = retrievalTopK;
            return this;
        }

        /// Sets the wall-clock limit of a whole run.
        ///
        /// @param runTimeout run timeout, or null for no limit
        /// @return this builder for chaining
        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public RagweaveConfig build() {
            return new RagweaveConfig(this);
        }
    }
}
