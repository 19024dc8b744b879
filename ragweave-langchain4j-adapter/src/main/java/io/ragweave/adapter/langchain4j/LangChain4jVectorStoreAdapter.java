package io.ragweave.adapter.langchain4j;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import io.ragweave.core.adapter.VectorMatch;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.exception.AdapterException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/// {@link VectorStoreAdapter} over a LangChain4j {@link EmbeddingStore}.
///
/// Chunk metadata is stored on the embedded {@link TextSegment}: the `text`
/// entry becomes the segment text and every other entry becomes segment
/// metadata. Values LangChain4j metadata cannot hold (anything but strings,
/// UUIDs and numbers) are stored as strings.
///
/// Scores are the store's relevance scores. For the LangChain4j in-memory
/// store that is cosine similarity mapped to `[0, 1]`.
///
/// @implNote Thread-safe if the wrapped store is.
public class LangChain4jVectorStoreAdapter implements VectorStoreAdapter {

    private static final Logger logger =
            Logger.getLogger(LangChain4jVectorStoreAdapter.class.getName());

    private final String provider;
    private final EmbeddingStore<TextSegment> store;

    public LangChain4jVectorStoreAdapter(EmbeddingStore<TextSegment> store) {
        this("langchain4j", store);
    }

    /// Creates an adapter.
    ///
    /// @param provider name reported on adapter errors, not null
    /// @param store embedding store to wrap, not null; must support removal by id
    public LangChain4jVectorStoreAdapter(String provider, EmbeddingStore<TextSegment> store) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /// Inserts or replaces a vector.
    ///
    /// @param id vector id, not null
    /// @param vector embedding, not null
    /// @param metadata chunk metadata including a non-blank `text`, not null
    /// @throws IllegalArgumentException if `text` is missing
    @Override
    public void upsert(String id, float[] vector, Map<String, Object> metadata) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");

        Object text = metadata.get(VectorMatch.TEXT);
        if (text == null || text.toString().isBlank()) {
            throw new IllegalArgumentException("metadata of vector '" + id + "' must contain 'text'");
        }
        TextSegment segment = TextSegment.from(text.toString(), segmentMetadata(metadata));
        try {
            store.remove(id);
            store.addAll(List.of(id), List.of(Embedding.from(vector)), List.of(segment));
        } catch (RuntimeException e) {
            throw LangChain4jErrors.translate(provider, e);
        }
        logger.fine("Upserted vector '" + id + "' into " + provider + " store");
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k) {
        Objects.requireNonNull(vector, "vector must not be null");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }

        EmbeddingSearchRequest request =
                EmbeddingSearchRequest.builder()
                        .queryEmbedding(Embedding.from(vector))
                        .maxResults(k)
                        .build();
        EmbeddingSearchResult<TextSegment> result;
        try {
            result = store.search(request);
        } catch (RuntimeException e) {
            throw LangChain4jErrors.translate(provider, e);
        }

        List<VectorMatch> matches = new ArrayList<>(result.matches().size());
        for (EmbeddingMatch<TextSegment> match : result.matches()) {
            matches.add(toVectorMatch(match));
        }
        return matches;
    }

    private VectorMatch toVectorMatch(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        if (segment == null) {
            throw new AdapterException(
                    provider,
                    AdapterException.Reason.MALFORMED_RESPONSE,
                    "Vector '" + match.embeddingId() + "' has no stored segment");
        }
        Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata().toMap());
        metadata.put(VectorMatch.TEXT, segment.text());
        double score = match.score() != null ? match.score() : 0.0;
        return new VectorMatch(match.embeddingId(), score, metadata);
    }

    private static Metadata segmentMetadata(Map<String, Object> metadata) {
        Map<String, Object> values = new HashMap<>();
        metadata.forEach(
                (key, value) -> {
                    if (VectorMatch.TEXT.equals(key) || value == null) {
                        return;
                    }
                    if (value instanceof String
                            || value instanceof UUID
                            || value instanceof Integer
                            || value instanceof Long
                            || value instanceof Float
                            || value instanceof Double) {
                        values.put(key, value);
                    } else {
                        values.put(key, value.toString());
                    }
                });
        return Metadata.from(values);
    }
}
