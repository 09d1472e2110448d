package ch.so.arp.docchat.document;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docchat.embedding.EmbeddingClient;
import ch.so.arp.docchat.error.ServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.store.ChunkStore;
import ch.so.arp.docchat.support.ServiceOutcome;

/**
 * Turns raw document text into stored, searchable chunks. Embedding is best
 * effort: chunks whose batch could not be embedded are stored without a vector
 * and remain reachable through keyword search.
 */
public class IngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionService.class);

    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final ChunkStore chunkStore;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public IngestionService(Chunker chunker, EmbeddingClient embeddingClient, ChunkStore chunkStore, Clock clock) {
        this(chunker, embeddingClient, chunkStore, clock, () -> UUID.randomUUID().toString());
    }

    IngestionService(Chunker chunker, EmbeddingClient embeddingClient, ChunkStore chunkStore, Clock clock,
            Supplier<String> idGenerator) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.chunkStore = Objects.requireNonNull(chunkStore, "chunkStore");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Chunks, embeds and stores a document.
     *
     * @throws ValidationException if the title is blank, the text is empty or
     *                             the category is unknown
     */
    public IngestionResult ingest(IngestionRequest request) {
        if (request == null) {
            throw new ValidationException("Ingestion request must not be null");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("Document title must not be empty");
        }
        if (request.content() == null || request.content().isEmpty()) {
            throw new ValidationException("Document text must not be empty");
        }
        DocumentCategory category = DocumentCategory.fromValue(request.category());
        String sourceFileName = request.sourceFileName() == null || request.sourceFileName().isBlank()
                ? request.title()
                : request.sourceFileName();

        IngestionState state = IngestionState.UPLOADED;
        Document document = new Document(idGenerator.get(), request.title(), request.content(), category,
                sourceFileName, clock.instant(), request.ownerId());

        List<TextChunk> windows = chunker.chunk(document.content());
        List<Chunk> chunks = new ArrayList<>(windows.size());
        for (TextChunk window : windows) {
            chunks.add(new Chunk(idGenerator.get(), document.id(), window.content(), window.chunkIndex(),
                    ChunkEmbedding.none()));
        }
        state = state.transitionTo(IngestionState.CHUNKED);

        List<Chunk> embedded = embed(document, chunks);
        int embeddedCount = (int) embedded.stream().filter(chunk -> chunk.embedding().isEmbedded()).count();
        IngestionState embeddingState = state.transitionTo(IngestionState.afterEmbedding(embeddedCount,
                embedded.size()));

        chunkStore.put(document, embedded);
        state = embeddingState.transitionTo(IngestionState.INDEXED);
        LOGGER.info("Ingested document {} ('{}'): {} chunk(s), {} embedded ({})", document.id(), document.title(),
                embedded.size(), embeddedCount, embeddingState);
        return new IngestionResult(document, embedded.size(), embeddedCount, embeddingState, state);
    }

    /**
     * Stores a generated document. The source file name is derived from the
     * title.
     */
    public IngestionResult saveGenerated(String title, String content, String category) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Valid title is required");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException("Valid content is required");
        }
        String trimmedTitle = title.strip();
        return ingest(new IngestionRequest(trimmedTitle, content.strip(), category, fileNameFor(trimmedTitle), null));
    }

    /**
     * Removes a document together with its chunks.
     *
     * @return {@link IngestionState#DELETED}
     * @throws ch.so.arp.docchat.error.NotFoundException if the document does
     *                                                   not exist
     */
    public IngestionState delete(String documentId) {
        chunkStore.deleteDocument(documentId);
        LOGGER.info("Deleted document {}", documentId);
        return IngestionState.INDEXED.transitionTo(IngestionState.DELETED);
    }

    public List<Document> listDocuments() {
        return chunkStore.listDocuments();
    }

    public Document getDocument(String documentId) {
        return chunkStore.getDocument(documentId);
    }

    /**
     * @throws ch.so.arp.docchat.error.NotFoundException if the document does
     *                                                   not exist
     */
    public List<Chunk> getChunks(String documentId) {
        chunkStore.getDocument(documentId);
        return chunkStore.getByDocument(documentId);
    }

    static String fileNameFor(String title) {
        return title.replaceAll("[^a-zA-Z0-9]", "_") + ".md";
    }

    private List<Chunk> embed(Document document, List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return chunks;
        }
        if (!embeddingClient.isAvailable()) {
            LOGGER.warn("Embedding service not configured, storing {} chunk(s) of {} without embeddings",
                    chunks.size(), document.id());
            return chunks;
        }
        int batchSize = embeddingClient.maxBatchSize();
        List<Chunk> result = new ArrayList<>(chunks.size());
        for (int start = 0; start < chunks.size(); start += batchSize) {
            List<Chunk> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size()));
            result.addAll(embedBatch(document, batch));
        }
        return result;
    }

    private List<Chunk> embedBatch(Document document, List<Chunk> batch) {
        List<String> texts = batch.stream().map(Chunk::content).toList();
        if (!texts.stream().allMatch(embeddingClient::accepts)) {
            LOGGER.warn("Batch of {} chunk(s) of {} exceeds the embedding input limit, storing without embeddings",
                    batch.size(), document.id());
            return batch;
        }
        ServiceOutcome<List<float[]>> outcome = embeddingClient.tryEmbedBatch(texts);
        if (outcome instanceof ServiceOutcome.Failure<List<float[]>> failure) {
            logEmbeddingFailure(document, batch.size(), failure);
            return batch;
        }
        List<float[]> vectors = outcome.orElseThrow();
        List<Chunk> embedded = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            embedded.add(batch.get(i).withEmbedding(ChunkEmbedding.of(vectors.get(i))));
        }
        return embedded;
    }

    private static void logEmbeddingFailure(Document document, int chunkCount,
            ServiceOutcome.Failure<List<float[]>> failure) {
        ServiceException error = failure.error();
        if (error.isRetryable()) {
            LOGGER.warn("Embedding {} chunk(s) of {} failed after {} attempt(s), storing without embeddings: {}",
                    chunkCount, document.id(), failure.attempts(), error.getMessage());
        } else {
            LOGGER.error("Embedding {} chunk(s) of {} failed permanently, storing without embeddings: {}",
                    chunkCount, document.id(), error.getMessage());
        }
    }
}
