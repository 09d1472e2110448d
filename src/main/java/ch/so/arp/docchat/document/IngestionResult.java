package ch.so.arp.docchat.document;

/**
 * Outcome of an ingestion. {@code embeddedChunks} may be lower than
 * {@code chunksCreated} when the embedding service was unavailable;
 * {@code embeddingState} records which embedding stage the document passed
 * through before reaching {@code state}.
 */
public record IngestionResult(Document document, int chunksCreated, int embeddedChunks,
        IngestionState embeddingState, IngestionState state) {
}
