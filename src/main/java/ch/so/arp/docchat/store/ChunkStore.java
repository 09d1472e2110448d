package ch.so.arp.docchat.store;

import java.util.List;
import java.util.Optional;

import ch.so.arp.docchat.document.Chunk;
import ch.so.arp.docchat.document.Document;
import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.NotFoundException;

/**
 * Storage for documents and their chunks. Implementations are drop-in
 * replacements for each other; callers never branch on the concrete backend.
 */
public interface ChunkStore {

    /**
     * Store a document together with its complete chunk set. Either the
     * document and all chunks become visible at once or nothing is stored.
     *
     * @param document the document to store
     * @param chunks   all chunks of the document, possibly empty
     * @throws ch.so.arp.docchat.error.ConflictException   if the document id is
     *                                                     already stored
     * @throws ch.so.arp.docchat.error.ValidationException if a chunk belongs to a
     *                                                     different document or
     *                                                     has an embedding of the
     *                                                     wrong dimension
     */
    void put(Document document, List<Chunk> chunks);

    Optional<Document> findDocument(String documentId);

    default Document getDocument(String documentId) {
        return findDocument(documentId)
                .orElseThrow(() -> new NotFoundException("Document " + documentId + " does not exist"));
    }

    /**
     * @return all documents, most recently uploaded first
     */
    List<Document> listDocuments();

    /**
     * @return the chunks of the document ordered by chunk index, empty if the
     *         document is unknown
     */
    List<Chunk> getByDocument(String documentId);

    /**
     * Rank embedded chunks by similarity to the query embedding.
     *
     * @param queryEmbedding the query vector
     * @param limit          the maximum number of results
     * @return ranked results joined with their documents, or
     *         {@link VectorSearchOutcome.Unavailable} when this store cannot
     *         answer vector queries right now
     */
    VectorSearchOutcome vectorSearch(float[] queryEmbedding, int limit);

    /**
     * Keyword search over chunk content. Results carry the deterministic
     * keyword overlap as score and are ranked by it.
     *
     * @param queryText the query
     * @param limit     the maximum number of results
     * @return matching chunks joined with their documents
     */
    List<SearchResult> lexicalSearch(String queryText, int limit);

    /**
     * Delete a document and all of its chunks.
     *
     * @throws NotFoundException if the document does not exist
     */
    void deleteDocument(String documentId);

    long embeddedChunkCount();
}
