package io.ragweave.core.retrieval;

import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.VectorMatch;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.cache.CacheLayer;
import io.ragweave.core.cache.CachingLlmAdapter;
import io.ragweave.core.cache.TextNormalizer;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.token.TokenEstimator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a query into a budgeted, ordered set of context chunks.
///
/// ### Steps
/// 1. Normalize the query and embed it through the cache layer.
/// 2. Fetch `k` nearest neighbours, discarding matches below the minimum similarity.
/// 3. Re-rank candidates, if a {@link Reranker} is configured.
/// 4. Deduplicate by {@link ChunkId}, keeping the highest score.
/// 5. Take chunks best-first until the next one would exceed the token budget.
///
/// Equal scores are ordered by chunk identity, so the same inputs always
/// produce the same result.
///
/// @implNote Thread-safe if the adapters are.
public final class RetrievalPipeline {

    private static final Logger logger = Logger.getLogger(RetrievalPipeline.class.getName());

    private static final Comparator<Chunk> BEST_FIRST =
            Comparator.comparingDouble(Chunk::score)
                    .reversed()
                    .thenComparing(Chunk::identity);

    private final LlmAdapter embedder;
    private final VectorStoreAdapter vectorStore;
    private final Reranker reranker;
    private final TokenEstimator tokenEstimator;

    /// Creates a pipeline.
    ///
    /// @param llm adapter used for query embeddings, not null
    /// @param vectorStore nearest-neighbour search backend, not null
    /// @param cache cache layer for query embeddings, not null
    /// @param reranker optional re-ranking stage, may be null
    /// @param tokenEstimator token counter for the context budget, not null
    public RetrievalPipeline(
            LlmAdapter llm,
            VectorStoreAdapter vectorStore,
            CacheLayer cache,
            Reranker reranker,
            TokenEstimator tokenEstimator) {
        Objects.requireNonNull(llm, "llm must not be null");
        Objects.requireNonNull(cache, "cache must not be null");
        this.embedder = new CachingLlmAdapter(llm, cache);
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
        this.reranker = reranker;
        this.tokenEstimator =
                Objects.requireNonNull(tokenEstimator, "tokenEstimator must not be null");
    }

    /// Retrieves context chunks for a query.
    ///
    /// @param query free-text query, not null or blank
    /// @param k number of nearest neighbours to request, positive
    /// @param options similarity floor and token budget, not null
    /// @return ordered, deduplicated chunks within budget, never null
    /// @throws ValidationException if the query is blank or `k` is not positive
    /// @throws AdapterException if a vector match carries malformed chunk metadata
    public RetrievalResult retrieve(String query, int k, RetrievalOptions options) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (k <= 0) {
            throw new ValidationException("k must be positive, got " + k);
        }
        String normalized = TextNormalizer.normalize(query);
        if (normalized.isEmpty()) {
            throw new ValidationException("Retrieval query must not be blank");
        }

        float[] queryVector = embedder.embed(normalized);

        List<Chunk> candidates = new ArrayList<>();
        for (VectorMatch match : vectorStore.query(queryVector, k)) {
            if (match.score() >= options.minSimilarity()) {
                candidates.add(toChunk(match));
            }
        }

        if (reranker != null && !candidates.isEmpty()) {
            candidates = reranker.rerank(normalized, candidates);
        }

        Map<ChunkId, Chunk> unique = new LinkedHashMap<>();
        for (Chunk chunk : candidates) {
            unique.merge(chunk.identity(), chunk, (a, b) -> a.score() >= b.score() ? a : b);
        }

        List<Chunk> ordered = new ArrayList<>(unique.values());
        ordered.sort(BEST_FIRST);

        List<Chunk> selected = new ArrayList<>();
        int used = 0;
        for (Chunk chunk : ordered) {
            int tokens = tokenEstimator.estimate(chunk.text());
            if (used + tokens > options.contextTokenBudget()) {
                break;
            }
            selected.add(chunk);
            used += tokens;
        }

        logger.fine(
                "Retrieved "
                        + selected.size()
                        + " of "
                        + ordered.size()
                        + " candidate chunks ("
                        + used
                        + "/"
                        + options.contextTokenBudget()
                        + " tokens)");
        return new RetrievalResult(selected, used);
    }

    static Chunk toChunk(VectorMatch match) {
        Map<String, Object> metadata = match.metadata();
        Object documentId = metadata.get(VectorMatch.DOCUMENT_ID);
        Object text = metadata.get(VectorMatch.TEXT);
        if (!(documentId instanceof String docId) || !(text instanceof String chunkText)) {
            throw malformed(match, "missing '" + VectorMatch.DOCUMENT_ID + "' or '" + VectorMatch.TEXT + "'");
        }
        int start = offset(match, VectorMatch.START_OFFSET);
        int end = offset(match, VectorMatch.END_OFFSET);
        if (start < 0 || end < start) {
            throw malformed(match, "invalid offset range [" + start + ", " + end + ")");
        }
        return Chunk.of(docId, start, end, chunkText, match.score());
    }

    private static int offset(VectorMatch match, String key) {
        Object value = match.metadata().get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw malformed(match, "non-numeric '" + key + "': " + s);
            }
        }
        throw malformed(match, "missing '" + key + "'");
    }

    private static AdapterException malformed(VectorMatch match, String detail) {
        return new AdapterException(
                "vector-store",
                AdapterException.Reason.MALFORMED_RESPONSE,
                "Vector match '" + match.id() + "' has malformed chunk metadata: " + detail);
    }
}
