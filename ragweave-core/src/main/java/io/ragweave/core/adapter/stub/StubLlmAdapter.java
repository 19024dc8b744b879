package io.ragweave.core.adapter.stub;

import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Testing LLM adapter that answers without calling an external API.
///
/// ### Generation
/// Responses registered with {@link #respondTo(String, String)} are returned
/// when the prompt contains the registered fragment; otherwise a stub response
/// echoing the prompt length is produced.
///
/// ### Embedding
/// Texts are embedded as a hashed bag of lower-cased words, normalised to unit
/// length. Texts sharing words therefore score higher under cosine similarity,
/// which is enough to exercise retrieval end to end.
///
/// @implNote Thread-safe. Call counters are exposed for cache assertions.
///
/// @see StubLlmProvider for enabling stub mode
public class StubLlmAdapter implements LlmAdapter {

    private static final Logger logger = Logger.getLogger(StubLlmAdapter.class.getName());

    public static final int DEFAULT_DIMENSION = 64;

    private final String modelId;
    private final int dimension;
    private final Map<String, String> scriptedResponses = new ConcurrentHashMap<>();
    private final AtomicInteger generateCalls = new AtomicInteger();
    private final AtomicInteger embedCalls = new AtomicInteger();

    public StubLlmAdapter() {
        this("stub-model", DEFAULT_DIMENSION);
    }

    /// Creates a stub adapter.
    ///
    /// @param modelId model identity reported to the cache layer, not null
    /// @param dimension embedding dimension, positive
    public StubLlmAdapter(String modelId, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.modelId = modelId;
        this.dimension = dimension;
    }

    /// Registers a canned response for prompts containing `fragment`.
    ///
    /// @param fragment text to look for in the prompt, not null
    /// @param response text to return, not null
    /// @return this adapter for chaining
    public StubLlmAdapter respondTo(String fragment, String response) {
        scriptedResponses.put(fragment, response);
        return this;
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        Instant start = Instant.now();
        generateCalls.incrementAndGet();
        String prompt = request.prompt();
        logger.fine("[STUB] generate called with prompt (" + prompt.length() + " chars)");

        String text =
                scriptedResponses.entrySet().stream()
                        .filter(e -> prompt.contains(e.getKey()))
                        .map(Map.Entry::getValue)
                        .findFirst()
                        .orElseGet(() -> "[STUB RESPONSE] prompt of " + prompt.length() + " chars");

        return new LlmResponse(
                text,
                countWords(prompt),
                countWords(text),
                Duration.between(start, Instant.now()),
                "stub:" + modelId);
    }

    @Override
    public float[] embed(String text) {
        embedCalls.incrementAndGet();
        float[] vector = new float[dimension];
        for (String word : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), dimension)] += 1f;
            }
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    /// Returns how many times {@link #generate} has been invoked.
    ///
    /// @return generate call count
    public int getGenerateCalls() {
        return generateCalls.get();
    }

    /// Returns how many times {@link #embed} has been invoked.
    ///
    /// @return embed call count
    public int getEmbedCalls() {
        return embedCalls.get();
    }

    private static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
