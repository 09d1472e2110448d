package ch.so.arp.docchat.embedding;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.docchat.support.OpenAiRestClients;
import ch.so.arp.docchat.support.RetryPolicy;

/**
 * Selects the embedding transport from {@code rag.embedding.provider} and wraps
 * it into the {@link EmbeddingClient}.
 */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfiguration {

    @Bean
    @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "none", matchIfMissing = true)
    public EmbeddingProvider unavailableEmbeddingProvider() {
        return new UnavailableEmbeddingProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "deterministic")
    public EmbeddingProvider deterministicEmbeddingProvider(EmbeddingProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(EmbeddingProperties properties) {
        return new OpenAiEmbeddingProvider(
                OpenAiRestClients.create(properties.getBaseUrl(), properties.getApiKey(), properties.getTimeout()),
                properties.getModel(), properties.getDimensions());
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingClient embeddingClient(EmbeddingProvider embeddingProvider, EmbeddingProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(properties.getMaxRetries(), properties.getBaseDelay());
        return new EmbeddingClient(embeddingProvider, retryPolicy, properties.getDimensions(),
                properties.getMaxInputChars(), properties.getMaxBatchSize());
    }
}
