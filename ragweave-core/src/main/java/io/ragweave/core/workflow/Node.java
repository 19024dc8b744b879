package io.ragweave.core.workflow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// One step of a workflow graph.
///
/// A node names the nodes it depends on; edges are id references resolved by
/// {@link WorkflowGraph}. Nodes never hold runtime state.
///
/// ### Failure tolerance
/// A node with {@link #isOptional()} set may fail without skipping its
/// dependents. A dependent can also tolerate individual dependencies by listing
/// them in {@link #getOptionalDependencies()}.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see WorkflowGraph for graph-level validation
public final class Node {

    private final String id;
    private final StepKind stepKind;
    private final List<String> dependsOn;
    private final Set<String> optionalDependencies;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final boolean optional;
    private final String handler;
    private final Map<String, Object> config;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.stepKind = Objects.requireNonNull(builder.stepKind, "Step kind required");
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.optionalDependencies =
                Collections.unmodifiableSet(new LinkedHashSet<>(builder.optionalDependencies));
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
        this.optional = builder.optional;
        this.handler = builder.handler;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));

        if (id.isBlank()) {
            throw new IllegalArgumentException("Node ID must not be blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Node '" + id + "' timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public StepKind getStepKind() {
        return stepKind;
    }

    /// Returns the ids of the nodes that must finish before this one starts.
    ///
    /// @return unmodifiable dependency ids in declaration order, never null
    public List<String> getDependsOn() {
        return dependsOn;
    }

    /// Returns the dependencies whose failure this node tolerates.
    ///
    /// @return unmodifiable subset of {@link #getDependsOn()}, never null
    public Set<String> getOptionalDependencies() {
        return optionalDependencies;
    }

    /// Returns the node's own retry policy.
    ///
    /// @return retry policy, or null to use the run default
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /// Returns the per-attempt timeout.
    ///
    /// @return timeout, or null to use the run default
    public Duration getTimeout() {
        return timeout;
    }

    public boolean isOptional() {
        return optional;
    }

    /// Returns the registered handler name for {@link StepKind#CUSTOM} nodes.
    ///
    /// @return handler name, or null for built-in kinds
    public String getHandler() {
        return handler;
    }

    /// Returns step-specific settings (query template, `top_k`, template name, ...).
    ///
    /// @return unmodifiable config map, never null
    public Map<String, Object> getConfig() {
        return config;
    }

    public boolean isRoot() {
        return dependsOn.isEmpty();
    }

    /// Checks whether this node may run when `dependency` did not succeed.
    ///
    /// @param dependency the failed or skipped dependency, not null
    /// @return true if the dependency is optional or listed as an optional dependency
    public boolean tolerates(Node dependency) {
        return dependency.isOptional() || optionalDependencies.contains(dependency.getId());
    }

    @Override
    public String toString() {
        return "Node{" + id + ", " + stepKind + ", dependsOn=" + dependsOn + "}";
    }

    /// Builder for {@link Node}.
    ///
    /// Required fields: `id`, `stepKind`.
    public static final class Builder {
        private String id;
        private StepKind stepKind;
        private final List<String> dependsOn = new ArrayList<>();
        private final Set<String> optionalDependencies = new LinkedHashSet<>();
        private RetryPolicy retryPolicy;
        private Duration timeout;
        private boolean optional;
        private String handler;
        private final Map<String, Object> config = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder stepKind(StepKind stepKind) {
            this.stepKind = stepKind;
            return this;
        }

        /// Adds required dependencies.
        ///
        /// @param ids dependency node ids, not null
        /// @return this builder for chaining
        public Builder dependsOn(String... ids) {
            this.dependsOn.addAll(List.of(ids));
            return this;
        }

        public Builder dependsOn(List<String> ids) {
            this.dependsOn.addAll(ids);
            return this;
        }

        /// Marks dependencies whose failure this node tolerates.
        ///
        /// Each id must also be declared through {@link #dependsOn}.
        ///
        /// @param ids dependency node ids, not null
        /// @return this builder for chaining
        public Builder optionalDependencies(String... ids) {
            this.optionalDependencies.addAll(List.of(ids));
            return this;
        }

        public Builder optionalDependencies(Set<String> ids) {
            this.optionalDependencies.addAll(ids);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config.putAll(config);
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
