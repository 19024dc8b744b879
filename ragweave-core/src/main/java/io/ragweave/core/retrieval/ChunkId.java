package io.ragweave.core.retrieval;

import java.util.Comparator;
import java.util.Objects;

/// Identity of a {@link Chunk}: its document and character range.
///
/// @param documentId source document id, not null
/// @param startOffset inclusive start offset
/// @param endOffset exclusive end offset
public record ChunkId(String documentId, int startOffset, int endOffset)
        implements Comparable<ChunkId> {

    private static final Comparator<ChunkId> ORDER =
            Comparator.comparing(ChunkId::documentId)
                    .thenComparingInt(ChunkId::startOffset)
                    .thenComparingInt(ChunkId::endOffset);

    public ChunkId {
        Objects.requireNonNull(documentId, "documentId must not be null");
    }

    @Override
    public int compareTo(ChunkId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return documentId + ":" + startOffset + "-" + endOffset;
    }
}
