package ch.so.arp.docchat.store;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docchat.document.Chunk;
import ch.so.arp.docchat.document.Document;
import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.ConflictException;
import ch.so.arp.docchat.error.NotFoundException;

/**
 * Ephemeral {@link ChunkStore} keeping everything in process memory. A
 * document and its chunk list are published with a single map write, so
 * readers see either the whole chunk set or nothing. There is no vector
 * operator; vector queries are reported as unavailable and callers fall back to
 * lexical search.
 */
class InMemoryChunkStore implements ChunkStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkStore.class);

    static final String NO_VECTOR_OPERATOR = "in-memory store has no vector similarity operator";

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final int dimensions;

    InMemoryChunkStore(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public void put(Document document, List<Chunk> chunks) {
        List<Chunk> ordered = ChunkSets.validated(document, chunks, dimensions);
        StoredDocument previous = documents.putIfAbsent(document.id(), new StoredDocument(document, ordered));
        if (previous != null) {
            throw new ConflictException("Document " + document.id() + " already exists");
        }
        LOGGER.debug("Stored document {} with {} chunks in memory", document.id(), ordered.size());
    }

    @Override
    public Optional<Document> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId)).map(StoredDocument::document);
    }

    @Override
    public List<Document> listDocuments() {
        return documents.values().stream()
                .map(StoredDocument::document)
                .sorted(Comparator.comparing(Document::uploadedAt).reversed().thenComparing(Document::id))
                .toList();
    }

    @Override
    public List<Chunk> getByDocument(String documentId) {
        StoredDocument stored = documents.get(documentId);
        return stored == null ? List.of() : stored.chunks();
    }

    @Override
    public VectorSearchOutcome vectorSearch(float[] queryEmbedding, int limit) {
        ChunkSets.checkLimit(limit);
        return VectorSearchOutcome.unavailable(NO_VECTOR_OPERATOR);
    }

    @Override
    public List<SearchResult> lexicalSearch(String queryText, int limit) {
        ChunkSets.checkLimit(limit);
        LexicalScorer scorer = LexicalScorer.forQuery(queryText);
        return documents.values().stream()
                .flatMap(stored -> stored.chunks().stream()
                        .map(chunk -> new SearchResult(chunk, stored.document(), scorer.score(chunk.content()))))
                .filter(result -> result.similarityScore() > 0.0d)
                .sorted(SearchResult.RANKING)
                .limit(limit)
                .toList();
    }

    @Override
    public void deleteDocument(String documentId) {
        StoredDocument removed = documents.remove(documentId);
        if (removed == null) {
            throw new NotFoundException("Document " + documentId + " does not exist");
        }
        LOGGER.debug("Removed document {} and {} chunks from memory", documentId, removed.chunks().size());
    }

    @Override
    public long embeddedChunkCount() {
        return documents.values().stream()
                .flatMap(stored -> stored.chunks().stream())
                .filter(chunk -> chunk.embedding().isEmbedded())
                .count();
    }

    private record StoredDocument(Document document, List<Chunk> chunks) {
    }
}
