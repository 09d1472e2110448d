package ch.so.arp.docchat.chat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.docchat.support.OpenAiRestClients;
import ch.so.arp.docchat.support.RetryPolicy;

/**
 * Wires the language model integration. {@code rag.chat.mock-openai} decides
 * whether the mocked or the real OpenAI client answers.
 */
@Configuration
@EnableConfigurationProperties(OpenAiClientProperties.class)
public class ChatConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ExecutorService chatExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties) {
        return new OpenAiLlmClient(
                OpenAiRestClients.create(properties.getBaseUrl(), properties.getApiKey(), properties.getTimeout()),
                new RetryPolicy(properties.getMaxRetries(), properties.getBaseDelay()),
                properties.getModel(), properties.getTemperature());
    }
}
