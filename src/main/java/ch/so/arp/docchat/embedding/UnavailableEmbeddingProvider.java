package ch.so.arp.docchat.embedding;

import java.util.List;

import ch.so.arp.docchat.error.PermanentServiceException;

/**
 * Placeholder used when no embedding service is configured. Chunks are stored
 * without embeddings and searches use lexical matching.
 */
class UnavailableEmbeddingProvider implements EmbeddingProvider {

    static final String NOT_CONFIGURED = "Embedding service is not configured";

    @Override
    public List<float[]> embedAll(List<String> texts) {
        throw new PermanentServiceException(NOT_CONFIGURED);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
