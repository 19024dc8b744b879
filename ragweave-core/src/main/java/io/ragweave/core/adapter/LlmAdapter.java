package io.ragweave.core.adapter;

/// Capability contract for language-model inference and embedding.
///
/// Implementations are supplied externally (see the LangChain4j adapter module)
/// or by {@link io.ragweave.core.adapter.stub.StubLlmAdapter} for tests. Each
/// implementation is the single place where provider-specific failures are
/// translated into {@link io.ragweave.core.exception.TransientException} or
/// {@link io.ragweave.core.exception.AdapterException}.
///
/// ### Contracts
/// - **Postcondition**: `generate` never returns null
/// - **Postcondition**: `embed` returns a vector of the model's fixed dimension
///
/// @implNote Implementations must be thread-safe. Concurrent workflow nodes
/// share one adapter instance.
///
/// @see io.ragweave.core.adapter.spi.LlmProvider for pluggable creation
public interface LlmAdapter {

    /// Generates a completion for the request.
    ///
    /// @param request prompt and generation parameters, not null
    /// @return generated text with usage metadata, never null
    /// @throws io.ragweave.core.exception.TransientException on timeout, rate limit or network fault
    /// @throws io.ragweave.core.exception.AdapterException on any non-transient provider failure
    LlmResponse generate(LlmRequest request);

    /// Computes an embedding vector for the text.
    ///
    /// @param text text to embed, not null
    /// @return embedding vector, never null
    /// @throws io.ragweave.core.exception.TransientException on timeout, rate limit or network fault
    /// @throws io.ragweave.core.exception.AdapterException on any non-transient provider failure
    float[] embed(String text);

    /// Returns the identity of the model behind this adapter.
    ///
    /// Part of every cache fingerprint, so two adapters with the same id must
    /// produce interchangeable results.
    ///
    /// @return model identifier, never null
    String modelId();
}
