package ch.so.arp.docchat.support;

import java.time.Duration;

import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import ch.so.arp.docchat.error.ConfigurationException;

/**
 * Builds {@link RestClient}s for OpenAI compatible endpoints.
 */
public final class OpenAiRestClients {

    private OpenAiRestClients() {
    }

    public static RestClient create(String baseUrl, String apiKey, Duration timeout) {
        if (!StringUtils.hasText(apiKey)) {
            throw new ConfigurationException("An API key is required to call " + baseUrl);
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
    }
}
