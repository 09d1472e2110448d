package ch.so.arp.docchat.document;

import java.util.Objects;

/**
 * A bounded substring of a document used as the unit of retrieval.
 */
public record Chunk(String id, String documentId, String content, int chunkIndex, ChunkEmbedding embedding) {

    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(embedding, "embedding");
        if (content.isBlank()) {
            throw new IllegalArgumentException("chunk content must not be blank");
        }
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must not be negative");
        }
    }

    public Chunk withEmbedding(ChunkEmbedding newEmbedding) {
        return new Chunk(id, documentId, content, chunkIndex, newEmbedding);
    }
}
