package ch.so.arp.docchat.embedding;

import java.util.List;

/**
 * Strategy abstraction over the transport that computes embeddings.
 * Implementations either call a remote embedding API or provide deterministic
 * placeholders suited for tests and local development. Failures are reported
 * as {@link ch.so.arp.docchat.error.ServiceException}s so that the
 * {@link EmbeddingClient} can decide whether to retry.
 */
public interface EmbeddingProvider {

    /**
     * Create embedding vectors for the provided texts.
     *
     * @param texts the texts to embed, never empty
     * @return one vector per text in input order
     */
    List<float[]> embedAll(List<String> texts);

    /**
     * @return {@code false} if no embedding service is configured at all
     */
    default boolean isAvailable() {
        return true;
    }
}
