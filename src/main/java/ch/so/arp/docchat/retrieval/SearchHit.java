package ch.so.arp.docchat.retrieval;

import ch.so.arp.docchat.document.DocumentCategory;
import ch.so.arp.docchat.document.SearchResult;

/**
 * JSON view of a {@link SearchResult}.
 */
public record SearchHit(String chunkId, String documentId, String title, DocumentCategory category, int chunkIndex,
        String content, double similarityScore) {

    public static SearchHit of(SearchResult result) {
        return new SearchHit(
                result.chunk().id(),
                result.document().id(),
                result.document().title(),
                result.document().category(),
                result.chunk().chunkIndex(),
                result.chunk().content(),
                result.similarityScore());
    }
}
