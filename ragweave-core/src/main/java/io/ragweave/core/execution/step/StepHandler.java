package io.ragweave.core.execution.step;

/// Executes the work of one node kind.
///
/// Handlers are stateless with respect to runs: everything a single execution
/// needs arrives in the {@link StepContext}. The same handler instance serves
/// concurrent nodes and concurrent runs.
///
/// ### Failure contract
/// Throw {@link io.ragweave.core.exception.TransientException} (or let an
/// {@link java.io.IOException} escape) for failures worth retrying; any other
/// exception fails the node.
///
/// {@snippet :
/// registry.registerCustom("word-count", ctx -> {
///     String text = ctx.textVariables().get("answer").toString();
///     return text.split("\\s+").length;
/// });
/// }
///
/// @see StepHandlerRegistry
@FunctionalInterface
public interface StepHandler {

    /// Runs the step.
    ///
    /// @param context inputs, upstream outputs and run settings, not null
    /// @return the node output, may be null
    /// @throws Exception on failure; classified by the node runner
    Object execute(StepContext context) throws Exception;
}
