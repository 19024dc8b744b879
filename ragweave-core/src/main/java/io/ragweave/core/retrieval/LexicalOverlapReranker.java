package io.ragweave.core.retrieval;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/// Blends the vector score with how many distinct query terms a chunk contains.
///
/// `score = weight * vectorScore + (1 - weight) * coverage`, where coverage is
/// the fraction of distinct lower-cased query terms found in the chunk text.
public final class LexicalOverlapReranker implements Reranker {

    public static final double DEFAULT_VECTOR_WEIGHT = 0.7;

    private final double vectorWeight;

    public LexicalOverlapReranker() {
        this(DEFAULT_VECTOR_WEIGHT);
    }

    public LexicalOverlapReranker(double vectorWeight) {
        if (vectorWeight < 0.0 || vectorWeight > 1.0) {
            throw new IllegalArgumentException("vectorWeight must be in [0, 1], got " + vectorWeight);
        }
        this.vectorWeight = vectorWeight;
    }

    @Override
    public List<Chunk> rerank(String query, List<Chunk> candidates) {
        Set<String> queryTerms = terms(query);
        return candidates.stream()
                .map(c -> c.withScore(vectorWeight * c.score() + (1 - vectorWeight) * coverage(queryTerms, c)))
                .toList();
    }

    private static double coverage(Set<String> queryTerms, Chunk chunk) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> chunkTerms = terms(chunk.text());
        long found = queryTerms.stream().filter(chunkTerms::contains).count();
        return (double) found / queryTerms.size();
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
