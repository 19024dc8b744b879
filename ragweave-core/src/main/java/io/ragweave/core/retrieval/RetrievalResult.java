package io.ragweave.core.retrieval;

import io.ragweave.core.token.TokenEstimator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Ordered chunks selected for a query, with the tokens they occupy.
///
/// ### Contracts
/// - **Invariant**: scores are non-increasing along the list
/// - **Invariant**: no two chunks share an identity
///
/// @param chunks selected chunks, best first, never null
/// @param totalTokens tokens occupied by the chunk texts
public record RetrievalResult(List<Chunk> chunks, int totalTokens) {

    public RetrievalResult {
        Objects.requireNonNull(chunks, "chunks must not be null");
        chunks = List.copyOf(chunks);
        if (totalTokens < 0) {
            throw new IllegalArgumentException("totalTokens must not be negative");
        }
        Set<ChunkId> seen = new HashSet<>();
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            if (!seen.add(chunk.identity())) {
                throw new IllegalArgumentException("Duplicate chunk identity: " + chunk.identity());
            }
            if (i > 0 && chunk.score() > chunks.get(i - 1).score()) {
                throw new IllegalArgumentException(
                        "Chunks must be ordered by non-increasing score, violated at index " + i);
            }
        }
    }

    /// Combines several results into one, keeping the highest score per chunk
    /// identity and ordering best first with ties broken by identity.
    ///
    /// @param results results to merge, not null
    /// @param tokenEstimator counter used for the merged token total, not null
    /// @return merged result, never null
    public static RetrievalResult merge(List<RetrievalResult> results, TokenEstimator tokenEstimator) {
        if (results.size() == 1) {
            return results.get(0);
        }
        Map<ChunkId, Chunk> unique = new LinkedHashMap<>();
        for (RetrievalResult result : results) {
            for (Chunk chunk : result.chunks()) {
                unique.merge(chunk.identity(), chunk, (a, b) -> a.score() >= b.score() ? a : b);
            }
        }
        List<Chunk> ordered = new ArrayList<>(unique.values());
        ordered.sort(Comparator.comparingDouble(Chunk::score).reversed().thenComparing(Chunk::identity));
        int tokens = ordered.stream().mapToInt(c -> tokenEstimator.estimate(c.text())).sum();
        return new RetrievalResult(ordered, tokens);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), 0);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }
}
