package ch.so.arp.docchat.document;

/**
 * JSON view of a {@link Chunk}. The vector itself is not exposed, only whether
 * the chunk has one.
 */
public record ChunkView(String id, String documentId, String content, int chunkIndex, boolean embedded,
        int dimensions) {

    public static ChunkView of(Chunk chunk) {
        return new ChunkView(chunk.id(), chunk.documentId(), chunk.content(), chunk.chunkIndex(),
                chunk.embedding().isEmbedded(), chunk.embedding().dimensions());
    }
}
