package io.ragweave.core.adapter.memory;

import io.ragweave.core.adapter.VectorMatch;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.exception.AdapterException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory vector store using exact cosine similarity.
///
/// Intended for tests and small local corpora: every query scans all stored
/// vectors. Scores are raw cosine similarity in `[-1, 1]`.
///
/// @implNote Thread-safe. Upserts replace the whole record atomically.
public final class InMemoryVectorStore implements VectorStoreAdapter {

    private static final String PROVIDER = "in-memory";

    private record StoredVector(float[] vector, Map<String, Object> metadata) {}

    private final Map<String, StoredVector> vectors = new ConcurrentHashMap<>();

    @Override
    public void upsert(String id, float[] vector, Map<String, Object> metadata) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(vector, "vector must not be null");

        vectors.put(id, new StoredVector(vector.clone(), Map.copyOf(metadata)));
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k) {
        Objects.requireNonNull(vector, "vector must not be null");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }

        List<VectorMatch> matches = new ArrayList<>(vectors.size());
        vectors.forEach(
                (id, stored) ->
                        matches.add(
                                new VectorMatch(
                                        id, cosine(vector, stored.vector()), stored.metadata())));

        matches.sort(
                Comparator.comparingDouble(VectorMatch::score)
                        .reversed()
                        .thenComparing(VectorMatch::id));
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
    }

    /// Returns the number of stored vectors.
    ///
    /// @return vector count
    public int size() {
        return vectors.size();
    }

    private static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new AdapterException(
                    PROVIDER,
                    AdapterException.Reason.INVALID_REQUEST,
                    "Dimension mismatch: query has " + a.length + ", stored vector has " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
