package io.ragweave.core.prompt;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory template registry (default implementation). Thread-safe.
public final class DefaultPromptTemplateRegistry implements PromptTemplateRegistry {

    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @Override
    public void register(PromptTemplate template) {
        if (template == null) {
            throw new IllegalArgumentException("Template cannot be null");
        }
        templates.put(template.name(), template);
    }

    @Override
    public Optional<PromptTemplate> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    @Override
    public boolean contains(String name) {
        return templates.containsKey(name);
    }
}
