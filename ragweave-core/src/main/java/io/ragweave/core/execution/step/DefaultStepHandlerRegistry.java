package io.ragweave.core.execution.step;

import io.ragweave.core.workflow.StepKind;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link StepHandlerRegistry}.
///
/// Starts empty; {@link io.ragweave.core.RagweaveFactory} registers the built-in
/// handlers once their adapters are wired.
public class DefaultStepHandlerRegistry implements StepHandlerRegistry {

    private final Map<StepKind, StepHandler> builtIns = new ConcurrentHashMap<>();
    private final Map<String, StepHandler> customHandlers = new ConcurrentHashMap<>();

    @Override
    public void register(StepKind kind, StepHandler handler) {
        if (kind == null || kind == StepKind.CUSTOM) {
            throw new IllegalArgumentException("kind must be a built-in step kind, got " + kind);
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        builtIns.put(kind, handler);
    }

    @Override
    public void registerCustom(String name, StepHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        customHandlers.put(name, handler);
    }

    @Override
    public Optional<StepHandler> getHandler(StepKind kind) {
        return Optional.ofNullable(builtIns.get(kind));
    }

    @Override
    public Optional<StepHandler> getCustomHandler(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(customHandlers.get(name));
    }

    @Override
    public boolean hasCustomHandler(String name) {
        return name != null && customHandlers.containsKey(name);
    }
}
