package ch.so.arp.docchat.document;

import java.util.Comparator;
import java.util.Objects;

/**
 * A chunk matched by a query together with its parent document. Built at query
 * time and never persisted.
 *
 * @param similarityScore similarity in {@code [0, 1]}; for lexical matches the
 *                        normalized keyword overlap
 */
public record SearchResult(Chunk chunk, Document document, double similarityScore) {

    /**
     * Highest score first, ties broken by chunk index, document id and chunk id
     * so that equal inputs always produce the same order.
     */
    public static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::similarityScore).reversed()
            .thenComparingInt(result -> result.chunk().chunkIndex())
            .thenComparing(result -> result.chunk().documentId())
            .thenComparing(result -> result.chunk().id());

    public SearchResult {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(document, "document");
        if (Double.isNaN(similarityScore) || similarityScore < 0.0d || similarityScore > 1.0d) {
            throw new IllegalArgumentException("similarityScore must be within [0, 1]: " + similarityScore);
        }
    }
}
