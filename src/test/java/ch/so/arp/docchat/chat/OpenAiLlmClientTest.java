package ch.so.arp.docchat.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.TransientServiceException;
import ch.so.arp.docchat.support.RetryPolicy;

class OpenAiLlmClientTest {

    private static final String COMPLETION = """
            {"id": "chatcmpl-1", "choices": [
              {"index": 0, "message": {"role": "assistant", "content": "Six months of tenure."}, "finish_reason": "stop"}
            ]}
            """;

    private MockRestServiceServer server;
    private OpenAiLlmClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://example.invalid/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenAiLlmClient(builder.build(), new RetryPolicy(2, Duration.ZERO, delay -> {
        }), "gpt-4o-mini", 0.2d);
    }

    @Test
    void sendsSystemPromptAndContext() {
        server.expect(requestTo("https://example.invalid/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value(AgentMode.DOCUMENT_SEARCH.systemPrompt()))
                .andExpect(jsonPath("$.messages[1].content")
                        .value("Document excerpts:\n\nContent: tenure\n\nRequest: Who may work remotely?"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        String answer = client.generate("Who may work remotely?", "Content: tenure", AgentMode.DOCUMENT_SEARCH);

        assertThat(answer).isEqualTo("Six months of tenure.");
        server.verify();
    }

    @Test
    void retriesServerErrors() {
        server.expect(times(2), requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withServerError());
        server.expect(requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        assertThat(client.generate("prompt", "", AgentMode.DOCUMENT_CREATOR)).isEqualTo("Six months of tenure.");
        server.verify();
    }

    @Test
    void givesUpAfterRepeatedServerErrors() {
        server.expect(times(3), requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.generate("prompt", "", AgentMode.DOCUMENT_SEARCH))
                .isInstanceOf(TransientServiceException.class);
        server.verify();
    }

    @Test
    void doesNotRetryRejectedRequests() {
        server.expect(times(1), requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> client.generate("prompt", "", AgentMode.DOCUMENT_SEARCH))
                .isInstanceOf(PermanentServiceException.class);
        server.verify();
    }

    @Test
    void retriesGatewayPagesServedInsteadOfCompletions() {
        server.expect(requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withSuccess("<html><body>504 Gateway Time-out</body></html>", MediaType.TEXT_HTML));
        server.expect(requestTo("https://example.invalid/v1/chat/completions"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        assertThat(client.generate("prompt", "", AgentMode.DOCUMENT_SEARCH)).isEqualTo("Six months of tenure.");
        server.verify();
    }

    @Test
    void usesPromptAloneWithoutContext() {
        assertThat(OpenAiLlmClient.userMessage("Draft a policy", "")).isEqualTo("Draft a policy");
    }
}
