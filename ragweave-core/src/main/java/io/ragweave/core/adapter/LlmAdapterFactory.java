package io.ragweave.core.adapter;

import io.ragweave.core.adapter.spi.LlmProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates LLM adapters from a list of providers.
///
/// When creating an adapter, selects the highest-priority provider that
/// supports the requested model.
///
/// ### Provider Discovery
/// Providers are passed explicitly or discovered with {@link #loadProviders()}
/// from `META-INF/services/io.ragweave.core.adapter.spi.LlmProvider`.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// immutable once the factory is created.
///
/// @see LlmProvider for implementing custom backends
public class LlmAdapterFactory {

    private static final Logger logger = Logger.getLogger(LlmAdapterFactory.class.getName());

    private final List<LlmProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory over the given providers.
    ///
    /// @param credentials map of credential keys to values (e.g., `OPENAI_API_KEY`), not null
    /// @param providers candidate providers, not null
    public LlmAdapterFactory(Map<String, String> credentials, List<LlmProvider> providers) {
        this.credentials = new HashMap<>(credentials);
        this.providers = List.copyOf(providers);

        logger.info(
                "Loaded "
                        + providers.size()
                        + " LLM providers: "
                        + providers.stream().map(LlmProvider::getName).toList());
    }

    /// Creates an adapter using the best provider for the model.
    ///
    /// @param modelName model identifier, not null
    /// @return the created adapter, never null
    /// @throws IllegalStateException if no provider supports the model
    public LlmAdapter createAdapter(String modelName) {
        LlmProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(LlmProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(LlmProvider::getName)
                                                                .toList()));

        logger.info("Creating LLM adapter for '" + modelName + "' with provider: " + provider.getName());
        return provider.createAdapter(modelName, credentials);
    }

    /// Returns an unmodifiable view of all providers.
    ///
    /// @return list of available providers, never null
    public List<LlmProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    /// Checks if any provider supports the given model.
    ///
    /// @param modelName the model identifier to check, not null
    /// @return `true` if at least one provider supports this model
    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }

    /// Discovers all {@link LlmProvider} implementations on the classpath via
    /// {@link ServiceLoader}.
    ///
    /// @return discovered providers in load order, never null (may be empty)
    public static List<LlmProvider> loadProviders() {
        List<LlmProvider> loaded = new ArrayList<>();
        for (LlmProvider provider : ServiceLoader.load(LlmProvider.class)) {
            loaded.add(provider);
        }
        return loaded;
    }
}
