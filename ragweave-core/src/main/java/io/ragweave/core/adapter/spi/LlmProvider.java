package io.ragweave.core.adapter.spi;

import io.ragweave.core.adapter.LlmAdapter;
import java.util.List;
import java.util.Map;

/// Provider interface for pluggable language-model backends.
///
/// Implement this interface to add support for a new provider. Implementations
/// are wired explicitly via {@link io.ragweave.core.adapter.LlmAdapterFactory};
/// no classpath scanning or reflection is involved.
///
/// ### Registration
/// Pass provider instances to {@link io.ragweave.core.RagweaveFactory.Builder#llmProviders(List)}:
/// {@snippet :
/// var env = RagweaveFactory.builder()
///     .llmProviders(List.of(new LangChain4jProvider()))
///     .model("gpt-4o-mini")
///     .build();
/// }
///
/// ### Priority System
/// When multiple providers support the same model, the one with the highest
/// {@link #getPriority()} value is selected. Testing providers (like stub)
/// use high priorities to intercept all models when enabled.
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.ragweave.core.adapter.stub.StubLlmProvider for a testing implementation
public interface LlmProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name (e.g., "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can serve the specified model.
    ///
    /// @param modelName model identifier (e.g., "gpt-4o-mini"), not null
    /// @return `true` if this provider can create adapters for this model
    boolean supportsModel(String modelName);

    /// Creates an adapter for the model.
    ///
    /// @param modelName model identifier, not null
    /// @param credentials map of API keys and provider settings, not null
    /// @return configured adapter, never null
    /// @throws IllegalStateException if required credentials are missing
    LlmAdapter createAdapter(String modelName, Map<String, String> credentials);

    /// Returns this provider's priority for model selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
