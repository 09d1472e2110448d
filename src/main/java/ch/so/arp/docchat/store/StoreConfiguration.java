package ch.so.arp.docchat.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import ch.so.arp.docchat.embedding.EmbeddingProperties;

/**
 * Chooses the chunk store backend. {@code rag.store.durable=true} persists to
 * PostgreSQL, everything else keeps the data in memory for the lifetime of the
 * process.
 */
@Configuration
public class StoreConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "rag.store.durable", havingValue = "false", matchIfMissing = true)
    public ChunkStore inMemoryChunkStore(EmbeddingProperties embeddingProperties) {
        LOGGER.info("Using the in-memory chunk store; documents are lost on restart");
        return new InMemoryChunkStore(embeddingProperties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.store.durable", havingValue = "true")
    public ChunkStore jdbcChunkStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            EmbeddingProperties embeddingProperties) {
        LOGGER.info("Using the PostgreSQL chunk store with {} embedding dimensions",
                embeddingProperties.getDimensions());
        return new JdbcChunkStore(jdbcClient, transactionTemplate, embeddingProperties.getDimensions());
    }
}
