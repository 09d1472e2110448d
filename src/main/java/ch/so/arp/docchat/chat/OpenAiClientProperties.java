package ch.so.arp.docchat.chat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to connect to the OpenAI chat
 * completion API.
 */
@ConfigurationProperties(prefix = "rag.chat.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the OpenAI service.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the chat model that should be used.
     */
    private String model = "gpt-4o-mini";

    /**
     * Sampling temperature passed to the model.
     */
    private double temperature = 0.2d;

    /**
     * Retries after a transient failure, on top of the first attempt.
     */
    private int maxRetries = 3;

    /**
     * Delay before the first retry; doubled for every further retry.
     */
    private Duration baseDelay = Duration.ofSeconds(1);

    /**
     * Connect and read timeout of a single HTTP call.
     */
    private Duration timeout = Duration.ofSeconds(30);

    private Environment environment;

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

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
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
