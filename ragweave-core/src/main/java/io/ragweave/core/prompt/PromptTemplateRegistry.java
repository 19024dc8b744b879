package io.ragweave.core.prompt;

import java.util.Optional;

/// Lookup of prompt templates by name.
public interface PromptTemplateRegistry {

    /// Registers a template, replacing any with the same name.
    void register(PromptTemplate template);

    /// Find template by name.
    Optional<PromptTemplate> find(String name);

    /// Check if a template is registered.
    boolean contains(String name);
}
