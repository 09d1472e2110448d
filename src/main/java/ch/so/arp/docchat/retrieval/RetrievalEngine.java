package ch.so.arp.docchat.retrieval;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;

import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.embedding.EmbeddingClient;
import ch.so.arp.docchat.error.ConfigurationException;
import ch.so.arp.docchat.error.TransientServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.store.ChunkStore;
import ch.so.arp.docchat.store.VectorSearchOutcome;
import ch.so.arp.docchat.support.ServiceOutcome;

/**
 * Answers similarity queries. The query is embedded on a best effort basis;
 * whenever no vector ranking can be produced the engine falls back to keyword
 * search over the same store, so callers always receive a ranked list. A
 * transient failure of the vector query itself is treated the same way; any
 * other store failure propagates.
 */
public class RetrievalEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEngine.class);

    private final ChunkStore chunkStore;
    private final EmbeddingClient embeddingClient;
    private final int defaultLimit;

    public RetrievalEngine(ChunkStore chunkStore, EmbeddingClient embeddingClient, int defaultLimit) {
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        if (defaultLimit < 1) {
            throw new ConfigurationException("Default result limit must be at least 1");
        }
        this.defaultLimit = defaultLimit;
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public List<SearchResult> search(String queryText) {
        return search(queryText, defaultLimit);
    }

    /**
     * @param queryText the query, must not be blank
     * @param limit     maximum number of results, at least 1
     * @return at most {@code limit} results ordered by descending score
     */
    public List<SearchResult> search(String queryText, int limit) {
        if (queryText == null || queryText.isBlank()) {
            throw new ValidationException("Search query must not be empty");
        }
        if (limit < 1) {
            throw new ValidationException("Result limit must be at least 1 (got " + limit + ")");
        }
        List<SearchResult> results = rank(queryText, limit);
        return results.stream()
                .sorted(SearchResult.RANKING)
                .limit(limit)
                .toList();
    }

    private List<SearchResult> rank(String queryText, int limit) {
        if (!embeddingClient.accepts(queryText)) {
            LOGGER.warn("Query of {} characters cannot be embedded, using keyword search", queryText.length());
            return chunkStore.lexicalSearch(queryText, limit);
        }
        ServiceOutcome<float[]> embedding = embeddingClient.tryEmbedOne(queryText);
        if (embedding instanceof ServiceOutcome.Failure<float[]> failure) {
            LOGGER.warn("Query embedding failed after {} attempt(s), using keyword search: {}", failure.attempts(),
                    failure.error().getMessage());
            return chunkStore.lexicalSearch(queryText, limit);
        }
        VectorSearchOutcome outcome;
        try {
            outcome = chunkStore.vectorSearch(embedding.orElseThrow(), limit);
        } catch (TransientDataAccessException | TransientServiceException ex) {
            LOGGER.warn("Vector search failed, using keyword search: {}", ex.getMessage());
            return chunkStore.lexicalSearch(queryText, limit);
        }
        if (outcome instanceof VectorSearchOutcome.Ranked ranked) {
            LOGGER.debug("Vector search returned {} result(s)", ranked.results().size());
            return ranked.results();
        }
        LOGGER.info("Vector search unavailable ({}), using keyword search",
                ((VectorSearchOutcome.Unavailable) outcome).reason());
        return chunkStore.lexicalSearch(queryText, limit);
    }
}
