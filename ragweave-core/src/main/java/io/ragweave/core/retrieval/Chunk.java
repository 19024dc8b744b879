package io.ragweave.core.retrieval;

import java.util.Arrays;
import java.util.Objects;

/// A retrieved span of a source document.
///
/// Two chunks with the same document id and offset range are the same chunk
/// regardless of score; see {@link #identity()}.
///
/// @param documentId source document id, not null
/// @param startOffset inclusive start offset, non-negative
/// @param endOffset exclusive end offset, not less than `startOffset`
/// @param text chunk text, not null
/// @param score relevance score, higher is better
/// @param embedding stored embedding, may be null
public record Chunk(
        String documentId,
        int startOffset,
        int endOffset,
        String text,
        double score,
        float[] embedding) {

    public Chunk {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "Invalid offset range [" + startOffset + ", " + endOffset + ")");
        }
        embedding = embedding != null ? embedding.clone() : null;
    }

    public static Chunk of(String documentId, int startOffset, int endOffset, String text, double score) {
        return new Chunk(documentId, startOffset, endOffset, text, score, null);
    }

    public ChunkId identity() {
        return new ChunkId(documentId, startOffset, endOffset);
    }

    /// Returns a copy with a different score.
    ///
    /// @param newScore replacement score
    /// @return rescored chunk, never null
    public Chunk withScore(double newScore) {
        return new Chunk(documentId, startOffset, endOffset, text, newScore, embedding);
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk other)) return false;
        return startOffset == other.startOffset
                && endOffset == other.endOffset
                && Double.compare(score, other.score) == 0
                && documentId.equals(other.documentId)
                && text.equals(other.text)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(documentId, startOffset, endOffset, text, score);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Chunk{" + identity() + ", score=" + score + "}";
    }
}
