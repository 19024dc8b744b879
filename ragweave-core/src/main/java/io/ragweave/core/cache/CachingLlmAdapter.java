package io.ragweave.core.cache;

import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.exception.TransientException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/// {@link LlmAdapter} decorator that routes calls through a {@link CacheLayer}.
///
/// `generate` is keyed on (model, normalized prompt, generation parameters) and
/// honours {@link LlmRequest#cacheable()}. `embed` is keyed on (model,
/// normalized text). Concurrent identical calls reach the delegate once.
public final class CachingLlmAdapter implements LlmAdapter {

    static final String GENERATE_NAMESPACE = "generate";
    static final String EMBED_NAMESPACE = "embed";

    private final LlmAdapter delegate;
    private final CacheLayer cache;
    private final Duration ttl;

    public CachingLlmAdapter(LlmAdapter delegate, CacheLayer cache) {
        this(delegate, cache, null);
    }

    /// Creates the decorator.
    ///
    /// @param delegate adapter performing the real calls, not null
    /// @param cache cache layer, not null
    /// @param ttl entry lifetime, null for the cache layer default
    public CachingLlmAdapter(LlmAdapter delegate, CacheLayer cache, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.ttl = ttl;
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        CacheKey key =
                CacheKey.builder(GENERATE_NAMESPACE)
                        .model(delegate.modelId())
                        .text(request.prompt())
                        .parameters(request.parameters().asMap())
                        .build();
        CachePolicy policy = request.cacheable() ? CachePolicy.USE : CachePolicy.BYPASS;
        return call(key, policy, () -> delegate.generate(request));
    }

    @Override
    public float[] embed(String text) {
        Objects.requireNonNull(text, "text must not be null");
        CacheKey key = embedKey(delegate.modelId(), text);
        float[] vector = call(key, CachePolicy.USE, () -> delegate.embed(text));
        return vector.clone();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    /// Returns the key under which an embedding of `text` is cached.
    ///
    /// @param modelId embedding model identity, not null
    /// @param text raw text, normalized before hashing, not null
    /// @return cache key, never null
    public static CacheKey embedKey(String modelId, String text) {
        return CacheKey.builder(EMBED_NAMESPACE).model(modelId).text(text).build();
    }

    private <T> T call(CacheKey key, CachePolicy policy, Callable<T> compute) {
        try {
            return cache.getOrCompute(key, ttl, policy, compute);
        } catch (RuntimeException e) {
            throw e;
        } catch (IOException e) {
            throw new TransientException(
                    TransientException.Reason.NETWORK, "LLM call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException(
                    TransientException.Reason.TIMEOUT, "Interrupted while waiting for LLM call", e);
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception from LLM adapter", e);
        }
    }
}
