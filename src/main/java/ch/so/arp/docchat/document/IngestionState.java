package ch.so.arp.docchat.document;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a document while it passes through the ingestion pipeline.
 * {@link #DELETED} can be reached from every state.
 */
public enum IngestionState {

    UPLOADED,
    CHUNKED,
    EMBEDDED_PARTIALLY,
    EMBEDDED_FULLY,
    EMBEDDING_SKIPPED,
    INDEXED,
    DELETED;

    private Set<IngestionState> successors() {
        return switch (this) {
            case UPLOADED -> EnumSet.of(CHUNKED, DELETED);
            case CHUNKED -> EnumSet.of(EMBEDDED_PARTIALLY, EMBEDDED_FULLY, EMBEDDING_SKIPPED, DELETED);
            case EMBEDDED_PARTIALLY, EMBEDDED_FULLY, EMBEDDING_SKIPPED -> EnumSet.of(INDEXED, DELETED);
            case INDEXED -> EnumSet.of(DELETED);
            case DELETED -> EnumSet.noneOf(IngestionState.class);
        };
    }

    public boolean canTransitionTo(IngestionState next) {
        return successors().contains(next);
    }

    /**
     * @return {@code next}
     * @throws IllegalStateException if the lifecycle does not allow the step
     */
    public IngestionState transitionTo(IngestionState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal ingestion transition " + this + " -> " + next);
        }
        return next;
    }

    /**
     * State reached after embedding {@code embedded} of {@code total} chunks.
     */
    static IngestionState afterEmbedding(int embedded, int total) {
        if (embedded == 0) {
            return EMBEDDING_SKIPPED;
        }
        return embedded == total ? EMBEDDED_FULLY : EMBEDDED_PARTIALLY;
    }
}
