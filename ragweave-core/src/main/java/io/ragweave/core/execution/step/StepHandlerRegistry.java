package io.ragweave.core.execution.step;

import io.ragweave.core.exception.StepHandlerNotFound;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.StepKind;
import java.util.Optional;

/// Registry of step handlers.
///
/// Built-in kinds are keyed by {@link StepKind}; `CUSTOM` nodes are resolved by
/// their handler name.
///
/// ### Example usage
/// {@snippet :
/// registry.register(StepKind.RETRIEVE, new RetrieveStepHandler(pipeline));
/// registry.registerCustom("rerank-by-date", new DateRerankHandler());
/// StepHandler handler = registry.getHandlerFor(node);
/// }
public interface StepHandlerRegistry {

    /// Registers the handler for a built-in step kind.
    ///
    /// @param kind step kind other than CUSTOM, not null
    /// @param handler handler, not null
    /// @throws IllegalArgumentException if `kind` is CUSTOM
    void register(StepKind kind, StepHandler handler);

    /// Registers a handler for `CUSTOM` nodes naming `name`.
    ///
    /// @param name handler name, not null or blank
    /// @param handler handler, not null
    void registerCustom(String name, StepHandler handler);

    Optional<StepHandler> getHandler(StepKind kind);

    Optional<StepHandler> getCustomHandler(String name);

    boolean hasCustomHandler(String name);

    /// Resolves the handler that executes `node`.
    ///
    /// @param node the node, not null
    /// @return the handler, never null
    /// @throws StepHandlerNotFound if no handler is registered for the node's kind or name
    default StepHandler getHandlerFor(Node node) throws StepHandlerNotFound {
        if (node.getStepKind() == StepKind.CUSTOM) {
            return getCustomHandler(node.getHandler())
                    .orElseThrow(
                            () ->
                                    new StepHandlerNotFound(
                                            "No handler registered under '"
                                                    + node.getHandler()
                                                    + "' for node '"
                                                    + node.getId()
                                                    + "'"));
        }
        return getHandler(node.getStepKind())
                .orElseThrow(
                        () ->
                                new StepHandlerNotFound(
                                        "No handler registered for step kind "
                                                + node.getStepKind()
                                                + " (node '"
                                                + node.getId()
                                                + "')"));
    }
}
