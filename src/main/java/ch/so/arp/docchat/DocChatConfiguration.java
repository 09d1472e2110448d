package ch.so.arp.docchat;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.docchat.chat.ChatService;
import ch.so.arp.docchat.chat.LlmClient;
import ch.so.arp.docchat.document.Chunker;
import ch.so.arp.docchat.document.IngestionService;
import ch.so.arp.docchat.embedding.EmbeddingClient;
import ch.so.arp.docchat.error.ConfigurationException;
import ch.so.arp.docchat.retrieval.ContextAssembler;
import ch.so.arp.docchat.retrieval.RetrievalEngine;
import ch.so.arp.docchat.store.ChunkStore;

/**
 * Assembles the pipeline from the chosen store, embedding client and language
 * model. Invalid chunking settings stop the application at startup.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class DocChatConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Chunker chunker(PipelineProperties properties, EmbeddingClient embeddingClient) {
        PipelineProperties.Chunking chunking = properties.getChunking();
        Chunker chunker = new Chunker(chunking.getWindowSize(), chunking.getOverlap());
        if (chunker.windowSize() > embeddingClient.maxInputChars()) {
            throw new ConfigurationException("Chunk window size " + chunker.windowSize()
                    + " exceeds the embedding input limit of " + embeddingClient.maxInputChars() + " characters");
        }
        return chunker;
    }

    @Bean
    public IngestionService ingestionService(Chunker chunker, EmbeddingClient embeddingClient, ChunkStore chunkStore,
            Clock clock) {
        return new IngestionService(chunker, embeddingClient, chunkStore, clock);
    }

    @Bean
    public RetrievalEngine retrievalEngine(ChunkStore chunkStore, EmbeddingClient embeddingClient,
            PipelineProperties properties) {
        return new RetrievalEngine(chunkStore, embeddingClient, properties.getRetrieval().getDefaultLimit());
    }

    @Bean
    public ContextAssembler contextAssembler() {
        return new ContextAssembler();
    }

    @Bean
    public ChatService chatService(RetrievalEngine retrievalEngine, ContextAssembler contextAssembler,
            LlmClient llmClient, @Qualifier("chatExecutor") Executor chatExecutor, PipelineProperties properties) {
        return new ChatService(retrievalEngine, contextAssembler, llmClient, chatExecutor,
                properties.getRetrieval().getMaxContextChars(), properties.getChat().getRequestTimeout());
    }
}
