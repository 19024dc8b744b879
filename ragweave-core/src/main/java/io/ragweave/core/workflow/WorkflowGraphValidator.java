package io.ragweave.core.workflow;

import io.ragweave.core.exception.CycleDetectedException;
import io.ragweave.core.exception.ValidationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Structural checks run when a {@link WorkflowGraph} is built.
///
/// ### Rules
/// - the graph has at least one node and node ids are unique
/// - a node does not list a dependency twice; depending on itself is a cycle
/// - every dependency names a node of the graph
/// - optional dependencies are a subset of the declared dependencies
/// - `CUSTOM` nodes name a handler
/// - the graph is acyclic (three-colour depth-first search)
/// - at most one root unless multiple roots are allowed
///
/// @see WorkflowGraph.Builder#build()
final class WorkflowGraphValidator {

    private enum Colour {
        WHITE,
        GREY,
        BLACK
    }

    private WorkflowGraphValidator() {}

    /// Validates the nodes and returns them keyed by id in declaration order.
    ///
    /// @throws ValidationException on any structural error
    /// @throws CycleDetectedException if the dependencies form a cycle
    static Map<String, Node> validate(String graphId, List<Node> nodes, boolean allowMultipleRoots) {
        if (nodes.isEmpty()) {
            throw new ValidationException("Workflow '" + graphId + "' must contain at least one node");
        }

        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new ValidationException("Duplicate node id '" + node.getId() + "'");
            }
        }

        for (Node node : nodes) {
            Set<String> seen = new HashSet<>();
            for (String dependency : node.getDependsOn()) {
                if (dependency.equals(node.getId())) {
                    throw new CycleDetectedException(List.of(node.getId(), node.getId()));
                }
                if (!seen.add(dependency)) {
                    throw new ValidationException(
                            "Node '" + node.getId() + "' lists dependency '" + dependency + "' twice");
                }
                if (!byId.containsKey(dependency)) {
                    throw new ValidationException(
                            "Node '" + node.getId() + "' depends on unknown node '" + dependency + "'");
                }
            }
            for (String optional : node.getOptionalDependencies()) {
                if (!seen.contains(optional)) {
                    throw new ValidationException(
                            "Node '"
                                    + node.getId()
                                    + "' marks '"
                                    + optional
                                    + "' as optional dependency but does not depend on it");
                }
            }
            if (node.getStepKind() == StepKind.CUSTOM
                    && (node.getHandler() == null || node.getHandler().isBlank())) {
                throw new ValidationException(
                        "CUSTOM node '" + node.getId() + "' must name a handler");
            }
        }

        detectCycle(byId);

        List<String> roots = nodes.stream().filter(Node::isRoot).map(Node::getId).toList();
        if (roots.size() > 1 && !allowMultipleRoots) {
            throw new ValidationException(
                    "Workflow '"
                            + graphId
                            + "' has multiple roots "
                            + roots
                            + " but multiple roots are not allowed");
        }
        return byId;
    }

    private static void detectCycle(Map<String, Node> byId) {
        Map<String, Colour> colours = new HashMap<>();
        byId.keySet().forEach(id -> colours.put(id, Colour.WHITE));
        List<String> path = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (colours.get(id) == Colour.WHITE) {
                visit(id, byId, colours, path);
            }
        }
    }

    private static void visit(
            String id, Map<String, Node> byId, Map<String, Colour> colours, List<String> path) {
        colours.put(id, Colour.GREY);
        path.add(id);
        for (String dependency : byId.get(id).getDependsOn()) {
            Colour colour = colours.get(dependency);
            if (colour == Colour.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CycleDetectedException(cycle);
            }
            if (colour == Colour.WHITE) {
                visit(dependency, byId, colours, path);
            }
        }
        path.remove(path.size() - 1);
        colours.put(id, Colour.BLACK);
    }
}
