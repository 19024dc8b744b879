package io.ragweave.core.adapter;

import java.util.List;
import java.util.Map;

/// Capability contract for vector similarity search.
///
/// @implNote Implementations must be thread-safe.
///
/// @see io.ragweave.core.adapter.memory.InMemoryVectorStore for the in-process variant
public interface VectorStoreAdapter {

    /// Inserts or replaces the vector stored under `id`.
    ///
    /// @param id stable vector id, not null
    /// @param vector embedding, not null
    /// @param metadata values stored alongside the vector, not null
    void upsert(String id, float[] vector, Map<String, Object> metadata);

    /// Returns up to `k` stored vectors closest to `vector`.
    ///
    /// @param vector query embedding, not null
    /// @param k maximum number of results, positive
    /// @return matches ordered by descending score, never null
    List<VectorMatch> query(float[] vector, int k);
}
