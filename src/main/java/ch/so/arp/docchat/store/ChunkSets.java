package ch.so.arp.docchat.store;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ch.so.arp.docchat.document.Chunk;
import ch.so.arp.docchat.document.Document;
import ch.so.arp.docchat.error.ValidationException;

/**
 * Checks shared by all stores before a chunk set is written.
 */
final class ChunkSets {

    private ChunkSets() {
    }

    /**
     * @return the chunks ordered by chunk index
     */
    static List<Chunk> validated(Document document, List<Chunk> chunks, int dimensions) {
        if (document == null || chunks == null) {
            throw new ValidationException("Document and chunks must not be null");
        }
        Set<String> ids = new HashSet<>();
        Set<Integer> indexes = new HashSet<>();
        for (Chunk chunk : chunks) {
            if (!document.id().equals(chunk.documentId())) {
                throw new ValidationException(
                        "Chunk " + chunk.id() + " belongs to document " + chunk.documentId() + ", not " + document.id());
            }
            if (!ids.add(chunk.id())) {
                throw new ValidationException("Duplicate chunk id " + chunk.id());
            }
            if (!indexes.add(chunk.chunkIndex())) {
                throw new ValidationException("Duplicate chunk index " + chunk.chunkIndex() + " in " + document.id());
            }
            int actual = chunk.embedding().dimensions();
            if (actual != 0 && actual != dimensions) {
                throw new ValidationException(
                        "Chunk " + chunk.id() + " has " + actual + " dimensions, expected " + dimensions);
            }
        }
        return chunks.stream().sorted(Comparator.comparingInt(Chunk::chunkIndex)).toList();
    }

    static void checkQueryDimensions(float[] queryEmbedding, int dimensions) {
        if (queryEmbedding == null || queryEmbedding.length != dimensions) {
            throw new ValidationException("Query embedding must have " + dimensions + " dimensions");
        }
    }

    static void checkLimit(int limit) {
        if (limit < 1) {
            throw new ValidationException("Result limit must be at least 1 (got " + limit + ")");
        }
    }
}
