package io.ragweave.core.workflow;

/// What a node does when it runs.
///
/// The built-in kinds are served by the engine's own step handlers;
/// {@link #CUSTOM} nodes name a handler registered by the application.
///
/// @see io.ragweave.core.execution.step.StepHandlerRegistry
public enum StepKind {
    /// Embed a query and fetch budgeted context chunks.
    RETRIEVE,
    /// Render a prompt template with context, history and variables.
    ASSEMBLE_PROMPT,
    /// Call the language model.
    GENERATE,
    /// Application-defined step resolved by handler name.
    CUSTOM
}
