package ch.so.arp.docchat.embedding;

import java.util.ArrayList;
import java.util.Comparator;
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

/**
 * Calls the OpenAI compatible {@code /embeddings} endpoint. The rest client is
 * expected to carry the base URL and the authorization header.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;
    private final int dimensions;

    OpenAiEmbeddingProvider(RestClient restClient, String model, int dimensions) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EmbeddingRequest(model, texts, dimensions))
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientResponseException ex) {
            throw HttpFailures.classify("Embedding request", ex);
        } catch (ResourceAccessException ex) {
            throw HttpFailures.unreachable("Embedding request", ex);
        } catch (RestClientException ex) {
            throw HttpFailures.unreadable("Embedding request", ex);
        }
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            int received = response == null || response.data() == null ? 0 : response.data().size();
            throw new PermanentServiceException(
                    "Embedding count mismatch: requested " + texts.size() + ", received " + received);
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .forEach(data -> vectors.add(data.embedding()));
        LOGGER.debug("Received {} embeddings from model {}", vectors.size(), model);
        return vectors;
    }

    record EmbeddingRequest(String model, List<String> input, int dimensions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
