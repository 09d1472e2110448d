package ch.so.arp.docchat.embedding;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration of the embedding service and of the client side limits applied
 * before it is called.
 */
@ConfigurationProperties(prefix = "rag.embedding")
public class EmbeddingProperties implements EnvironmentAware {

    /**
     * Embedding transport: {@code none}, {@code deterministic} or {@code openai}.
     */
    private String provider = "none";

    /**
     * API key of the embedding service. Falls back to
     * {@code spring.ai.openai.api-key}.
     */
    private String apiKey;

    private String baseUrl = "https://api.openai.com/v1";

    private String model = "text-embedding-3-small";

    /**
     * Dimension shared by every stored embedding.
     */
    private int dimensions = 1536;

    /**
     * Longest text in characters that is sent to the service.
     */
    private int maxInputChars = 8000;

    /**
     * Largest number of texts per request.
     */
    private int maxBatchSize = 100;

    private int maxRetries = 3;

    /**
     * Backoff before the first retry; doubled for every further retry.
     */
    private Duration baseDelay = Duration.ofSeconds(1);

    /**
     * Connect and read timeout of a single request.
     */
    private Duration timeout = Duration.ofSeconds(30);

    private Environment environment;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("spring.ai.openai.api-key") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
