package ch.so.arp.docchat.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import ch.so.arp.docchat.error.ServiceException;

class HttpFailuresTest {

    @ParameterizedTest
    @ValueSource(ints = { 408, 425, 429, 500, 502, 503 })
    void classifiesRateLimitsAndServerErrorsAsTransient(int status) {
        ServiceException error = HttpFailures.classify("Embedding request", response(status));

        assertThat(error.isRetryable()).isTrue();
        assertThat(error).hasMessageContaining("HTTP " + status);
    }

    @ParameterizedTest
    @ValueSource(ints = { 400, 401, 403, 404, 422 })
    void classifiesClientErrorsAsPermanent(int status) {
        assertThat(HttpFailures.classify("Embedding request", response(status)).isRetryable()).isFalse();
    }

    @Test
    void treatsUnreachableServiceAsTransient() {
        ServiceException error = HttpFailures.unreachable("Chat completion",
                new ResourceAccessException("Connection refused", new IOException("refused")));

        assertThat(error.isRetryable()).isTrue();
        assertThat(error).hasMessageContaining("Chat completion");
    }

    @Test
    void treatsUnreadableResponseAsTransient() {
        ServiceException error = HttpFailures.unreadable("Embedding request",
                new RestClientException("no suitable HttpMessageConverter found for content type [text/html]"));

        assertThat(error.isRetryable()).isTrue();
        assertThat(error).hasMessageContaining("unreadable response");
    }

    private static RestClientResponseException response(int status) {
        return new RestClientResponseException("status " + status, HttpStatusCode.valueOf(status), "status " + status, new HttpHeaders(),
                new byte[0], StandardCharsets.UTF_8);
    }
}
