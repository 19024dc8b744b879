package io.ragweave.core.retrieval;

import java.util.List;

/// Re-scores retrieval candidates after the vector search.
///
/// Implementations return the same chunks with replaced scores; order is
/// irrelevant since the pipeline sorts afterwards.
@FunctionalInterface
public interface Reranker {

    /// Re-scores candidates for the query.
    ///
    /// @param query normalized query, not null
    /// @param candidates chunks that passed the similarity filter, not null
    /// @return rescored chunks, never null
    List<Chunk> rerank(String query, List<Chunk> candidates);
}
