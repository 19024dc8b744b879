package io.ragweave.core.adapter;

import java.util.Map;
import java.util.Objects;

/// One nearest-neighbour result from a {@link VectorStoreAdapter}.
///
/// Chunk data travels in the metadata under the keys declared here.
///
/// @param id id the vector was upserted under, not null
/// @param score similarity score, higher is closer
/// @param metadata metadata stored with the vector, never null
public record VectorMatch(String id, double score, Map<String, Object> metadata) {

    public static final String DOCUMENT_ID = "document_id";
    public static final String START_OFFSET = "start_offset";
    public static final String END_OFFSET = "end_offset";
    public static final String TEXT = "text";

    public VectorMatch {
        Objects.requireNonNull(id, "id must not be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
