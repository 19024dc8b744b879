package io.ragweave.core.workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable, validated dependency graph of {@link Node}s.
///
/// Nodes are stored by id in declaration order; dependency edges are id
/// references and the reverse (dependents) edges are derived at build time.
/// A graph is a read-only value and may be shared by any number of concurrent
/// runs.
///
/// ### Validation
/// {@link Builder#build()} rejects graphs with duplicate ids, dangling or
/// self dependencies, cycles, and more than one root unless
/// {@link Builder#allowMultipleRoots(boolean)} is set. Nothing executes for an
/// invalid graph.
///
/// {@snippet :
/// WorkflowGraph graph = WorkflowGraph.builder()
///     .id("qa")
///     .node(Node.builder().id("retrieve").stepKind(StepKind.RETRIEVE).build())
///     .node(Node.builder().id("prompt").stepKind(StepKind.ASSEMBLE_PROMPT)
///         .dependsOn("retrieve").config("template", "qa").build())
///     .node(Node.builder().id("answer").stepKind(StepKind.GENERATE)
///         .dependsOn("prompt").build())
///     .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see WorkflowGraphValidator for the validation rules
/// @see io.ragweave.core.execution.WorkflowScheduler for execution
public final class WorkflowGraph {

    private final String id;
    private final boolean allowMultipleRoots;
    private final Map<String, Node> nodes;
    private final Map<String, List<String>> dependents;

    private WorkflowGraph(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID required");
        this.allowMultipleRoots = builder.allowMultipleRoots;
        this.nodes =
                Collections.unmodifiableMap(
                        WorkflowGraphValidator.validate(id, builder.nodes, allowMultipleRoots));

        Map<String, List<String>> reverse = new LinkedHashMap<>();
        nodes.keySet().forEach(nodeId -> reverse.put(nodeId, new ArrayList<>()));
        for (Node node : nodes.values()) {
            for (String dependency : node.getDependsOn()) {
                reverse.get(dependency).add(node.getId());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        reverse.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.dependents = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public boolean isAllowMultipleRoots() {
        return allowMultipleRoots;
    }

    /// Returns all nodes in declaration order.
    ///
    /// @return unmodifiable node collection, never null
    public Collection<Node> getNodes() {
        return nodes.values();
    }

    /// Returns the ids of all nodes in declaration order.
    ///
    /// @return unmodifiable id set, never null
    public Set<String> getNodeIds() {
        return nodes.keySet();
    }

    public Optional<Node> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns the node with the given id.
    ///
    /// @param nodeId node id, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if no such node exists
    public Node getNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeId + "' in workflow '" + id + "'");
        }
        return node;
    }

    public int size() {
        return nodes.size();
    }

    /// Returns the nodes that can start now.
    ///
    /// A node is ready when it has not been started and every one of its
    /// dependencies is in `completed`.
    ///
    /// @param completed ids of nodes whose dependencies count as satisfied, not null
    /// @param started ids of nodes already dispatched or finished, not null
    /// @return ready nodes in declaration order, never null
    public List<Node> readySet(Set<String> completed, Set<String> started) {
        List<Node> ready = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (!started.contains(node.getId()) && completed.containsAll(node.getDependsOn())) {
                ready.add(node);
            }
        }
        return ready;
    }

    /// Returns the ids of nodes that depend directly on `nodeId`.
    ///
    /// @param nodeId node id, not null
    /// @return unmodifiable dependent ids in declaration order, never null
    /// @throws IllegalArgumentException if no such node exists
    public List<String> dependentsOf(String nodeId) {
        List<String> result = dependents.get(nodeId);
        if (result == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeId + "' in workflow '" + id + "'");
        }
        return result;
    }

    /// Returns the nodes without dependencies.
    ///
    /// @return root nodes in declaration order, never null
    public List<Node> roots() {
        return nodes.values().stream().filter(Node::isRoot).toList();
    }

    /// Returns every node id ordered so that each node follows its dependencies.
    ///
    /// Among nodes whose dependencies are all satisfied, declaration order wins.
    ///
    /// @return topological order of node ids, never null
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        nodes.values().forEach(n -> remaining.put(n.getId(), n.getDependsOn().size()));

        List<String> order = new ArrayList<>(nodes.size());
        Deque<String> queue = new ArrayDeque<>();
        nodes.values().stream().filter(Node::isRoot).forEach(n -> queue.add(n.getId()));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String dependent : dependents.get(current)) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" + id + ", nodes=" + nodes.keySet() + "}";
    }

    /// Builder for {@link WorkflowGraph}.
    ///
    /// Required fields: `id` and at least one node.
    ///
    /// @see #build() for validation rules
    public static final class Builder {
        private String id;
        private boolean allowMultipleRoots;
        private final List<Node> nodes = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        /// Permits more than one node without dependencies.
        ///
        /// @param allowMultipleRoots true to accept several roots (default false)
        /// @return this builder for chaining
        public Builder allowMultipleRoots(boolean allowMultipleRoots) {
            this.allowMultipleRoots = allowMultipleRoots;
            return this;
        }

        /// Validates and builds the graph.
        ///
        /// @return the immutable graph, never null
        /// @throws io.ragweave.core.exception.ValidationException on structural errors
        /// @throws io.ragweave.core.exception.CycleDetectedException if a cycle exists
        public WorkflowGraph build() {
            return new WorkflowGraph(this);
        }
    }
}
