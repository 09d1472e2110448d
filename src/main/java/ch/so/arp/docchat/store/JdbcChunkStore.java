package ch.so.arp.docchat.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.docchat.document.Chunk;
import ch.so.arp.docchat.document.ChunkEmbedding;
import ch.so.arp.docchat.document.Document;
import ch.so.arp.docchat.document.DocumentCategory;
import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.ConflictException;
import ch.so.arp.docchat.error.NotFoundException;

/**
 * Durable {@link ChunkStore} on PostgreSQL with the pgvector extension. Vector
 * queries rank by cosine distance ({@code <=>}) and join the parent document in
 * the same statement. Writes of a document and its chunks share one
 * transaction.
 */
class JdbcChunkStore implements ChunkStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcChunkStore.class);

    private static final String INSERT_DOCUMENT_SQL = """
            INSERT INTO documents (id, title, content, category, file_name, uploaded_at, owner_id)
            VALUES (:id, :title, :content, :category, :fileName, :uploadedAt, :ownerId)
            """;

    private static final String INSERT_CHUNK_SQL = """
            INSERT INTO document_chunks (id, document_id, content, chunk_index, embedding)
            VALUES (:id, :documentId, :content, :chunkIndex, CAST(:embedding AS vector))
            """;

    private static final String DOCUMENT_COLUMNS = """
            d.id AS document_id, d.title, d.content AS document_content, d.category, d.file_name,
            d.uploaded_at, d.owner_id""";

    private static final String SELECT_DOCUMENT_SQL = "SELECT " + DOCUMENT_COLUMNS + " FROM documents d WHERE d.id = :id";

    private static final String LIST_DOCUMENTS_SQL = "SELECT " + DOCUMENT_COLUMNS
            + " FROM documents d ORDER BY d.uploaded_at DESC, d.id";

    private static final String SELECT_CHUNKS_SQL = """
            SELECT c.id AS chunk_id, c.document_id, c.content AS chunk_content, c.chunk_index, c.embedding
            FROM document_chunks c
            WHERE c.document_id = :documentId
            ORDER BY c.chunk_index
            """;

    private static final String COUNT_EMBEDDED_SQL = "SELECT count(*) FROM document_chunks WHERE embedding IS NOT NULL";

    private static final String SEMANTIC_SQL = """
            SELECT
              c.id AS chunk_id, c.content AS chunk_content, c.chunk_index, c.embedding,
            """ + DOCUMENT_COLUMNS + """
            ,
              (c.embedding <=> CAST(:embedding AS vector)) AS distance
            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE c.embedding IS NOT NULL
            ORDER BY distance, c.chunk_index, c.document_id, c.id
            LIMIT :limit
            """;

    private static final String LEXICAL_SQL_PREFIX = """
            SELECT
              c.id AS chunk_id, c.content AS chunk_content, c.chunk_index, c.embedding,
            """ + DOCUMENT_COLUMNS + """

            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE
            """;

    private static final String DELETE_CHUNKS_SQL = "DELETE FROM document_chunks WHERE document_id = :documentId";
    private static final String DELETE_DOCUMENT_SQL = "DELETE FROM documents WHERE id = :documentId";

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final int dimensions;

    JdbcChunkStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, int dimensions) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.dimensions = dimensions;
    }

    @Override
    public void put(Document document, List<Chunk> chunks) {
        List<Chunk> ordered = ChunkSets.validated(document, chunks, dimensions);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcClient.sql(INSERT_DOCUMENT_SQL)
                        .param("id", document.id())
                        .param("title", document.title())
                        .param("content", document.content())
                        .param("category", document.category().value())
                        .param("fileName", document.sourceFileName())
                        .param("uploadedAt", OffsetDateTime.ofInstant(document.uploadedAt(), ZoneOffset.UTC))
                        .param("ownerId", document.ownerId())
                        .update();
                for (Chunk chunk : ordered) {
                    jdbcClient.sql(INSERT_CHUNK_SQL)
                            .param("id", chunk.id())
                            .param("documentId", chunk.documentId())
                            .param("content", chunk.content())
                            .param("chunkIndex", chunk.chunkIndex())
                            .param("embedding", chunk.embedding().fold(PgVectors::toLiteral, () -> null))
                            .update();
                }
            });
        } catch (DuplicateKeyException ex) {
            throw new ConflictException("Document " + document.id() + " or one of its chunks already exists", ex);
        }
        LOGGER.debug("Stored document {} with {} chunks", document.id(), ordered.size());
    }

    @Override
    public Optional<Document> findDocument(String documentId) {
        return jdbcClient.sql(SELECT_DOCUMENT_SQL)
                .param("id", documentId)
                .query(DocumentRowMapper.INSTANCE)
                .optional();
    }

    @Override
    public List<Document> listDocuments() {
        return jdbcClient.sql(LIST_DOCUMENTS_SQL)
                .query(DocumentRowMapper.INSTANCE)
                .list();
    }

    @Override
    public List<Chunk> getByDocument(String documentId) {
        return jdbcClient.sql(SELECT_CHUNKS_SQL)
                .param("documentId", documentId)
                .query((rs, rowNum) -> mapChunk(rs))
                .list();
    }

    @Override
    public VectorSearchOutcome vectorSearch(float[] queryEmbedding, int limit) {
        ChunkSets.checkLimit(limit);
        ChunkSets.checkQueryDimensions(queryEmbedding, dimensions);
        if (embeddedChunkCount() == 0) {
            return VectorSearchOutcome.unavailable("no stored chunk has an embedding");
        }
        List<SearchResult> results = jdbcClient.sql(SEMANTIC_SQL)
                .param("embedding", PgVectors.toLiteral(queryEmbedding))
                .param("limit", limit)
                .query((rs, rowNum) -> new SearchResult(mapChunk(rs), DocumentRowMapper.INSTANCE.mapRow(rs, rowNum),
                        similarity(rs.getDouble("distance"))))
                .list();
        LOGGER.debug("Vector search returned {} results (limit={})", results.size(), limit);
        return VectorSearchOutcome.ranked(results);
    }

    @Override
    public List<SearchResult> lexicalSearch(String queryText, int limit) {
        ChunkSets.checkLimit(limit);
        LexicalScorer scorer = LexicalScorer.forQuery(queryText);
        List<String> patterns = new ArrayList<>();
        patterns.add(likePattern(scorer.phrase()));
        scorer.terms().stream().sorted().map(JdbcChunkStore::likePattern).forEach(patterns::add);

        StringBuilder sql = new StringBuilder(LEXICAL_SQL_PREFIX);
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append("  lower(c.content) LIKE :p").append(i).append(" ESCAPE '\\'");
        }
        JdbcClient.StatementSpec statement = jdbcClient.sql(sql.toString());
        for (int i = 0; i < patterns.size(); i++) {
            statement = statement.param("p" + i, patterns.get(i));
        }
        List<SearchResult> results = statement
                .query((rs, rowNum) -> {
                    Chunk chunk = mapChunk(rs);
                    return new SearchResult(chunk, DocumentRowMapper.INSTANCE.mapRow(rs, rowNum),
                            scorer.score(chunk.content()));
                })
                .list()
                .stream()
                .filter(result -> result.similarityScore() > 0.0d)
                .sorted(SearchResult.RANKING)
                .limit(limit)
                .toList();
        LOGGER.debug("Lexical search for {} term(s) returned {} results", scorer.terms().size(), results.size());
        return results;
    }

    @Override
    public void deleteDocument(String documentId) {
        Integer deleted = transactionTemplate.execute(status -> {
            jdbcClient.sql(DELETE_CHUNKS_SQL).param("documentId", documentId).update();
            return jdbcClient.sql(DELETE_DOCUMENT_SQL).param("documentId", documentId).update();
        });
        if (deleted == null || deleted == 0) {
            throw new NotFoundException("Document " + documentId + " does not exist");
        }
    }

    @Override
    public long embeddedChunkCount() {
        return jdbcClient.sql(COUNT_EMBEDDED_SQL).query(Long.class).single();
    }

    private static double similarity(double cosineDistance) {
        return Math.max(0.0d, Math.min(1.0d, 1.0d - cosineDistance));
    }

    private static String likePattern(String value) {
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static Chunk mapChunk(ResultSet rs) throws SQLException {
        String embedding = rs.getString("embedding");
        return new Chunk(
                rs.getString("chunk_id"),
                rs.getString("document_id"),
                rs.getString("chunk_content"),
                rs.getInt("chunk_index"),
                embedding == null ? ChunkEmbedding.none() : ChunkEmbedding.of(PgVectors.parse(embedding)));
    }

    private enum DocumentRowMapper implements RowMapper<Document> {
        INSTANCE;

        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Document(
                    rs.getString("document_id"),
                    rs.getString("title"),
                    rs.getString("document_content"),
                    DocumentCategory.fromValue(rs.getString("category")),
                    rs.getString("file_name"),
                    rs.getObject("uploaded_at", OffsetDateTime.class).toInstant(),
                    rs.getString("owner_id"));
        }
    }
}
