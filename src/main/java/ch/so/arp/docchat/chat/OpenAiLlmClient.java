package ch.so.arp.docchat.chat;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.support.HttpFailures;
import ch.so.arp.docchat.support.RetryPolicy;

/**
 * {@link LlmClient} backed by the OpenAI chat completion endpoint. Transient
 * failures are retried through the {@link RetryPolicy}; whatever remains is
 * thrown to the caller.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final RetryPolicy retryPolicy;
    private final String model;
    private final double temperature;

    OpenAiLlmClient(RestClient restClient, RetryPolicy retryPolicy, String model, double temperature) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
    }

    @Override
    public String generate(String prompt, String context, AgentMode agentMode) {
        ChatCompletionRequest request = new ChatCompletionRequest(model, List.of(
                new Message("system", agentMode.systemPrompt()),
                new Message("user", userMessage(prompt, context))), temperature);
        LOGGER.debug("Requesting {} completion from model {} with {} context characters", agentMode, model,
                context.length());
        return retryPolicy.execute("Chat completion", () -> complete(request)).orElseThrow();
    }

    static String userMessage(String prompt, String context) {
        if (context.isEmpty()) {
            return prompt;
        }
        return "Document excerpts:\n\n" + context + "\n\nRequest: " + prompt;
    }

    private String complete(ChatCompletionRequest request) {
        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientResponseException ex) {
            throw HttpFailures.classify("Chat completion", ex);
        } catch (ResourceAccessException ex) {
            throw HttpFailures.unreachable("Chat completion", ex);
        } catch (RestClientException ex) {
            throw HttpFailures.unreadable("Chat completion", ex);
        }
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null
                || response.choices().get(0).message().content() == null) {
            throw new PermanentServiceException("Chat completion returned no answer");
        }
        return response.choices().get(0).message().content();
    }

    record ChatCompletionRequest(String model, List<Message> messages, double temperature) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }
}
