package ch.so.arp.docchat.embedding;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docchat.error.ConfigurationException;
import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.support.RetryPolicy;
import ch.so.arp.docchat.support.ServiceOutcome;

/**
 * Front door to the embedding service. Validates input sizes, keeps the 1:1
 * correspondence between texts and vectors, enforces the deployment dimension
 * and retries transient failures through the {@link RetryPolicy}.
 * <p>
 * The client holds no mutable state and may be used concurrently.
 */
public class EmbeddingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingProvider provider;
    private final RetryPolicy retryPolicy;
    private final int dimensions;
    private final int maxInputChars;
    private final int maxBatchSize;

    public EmbeddingClient(EmbeddingProvider provider, RetryPolicy retryPolicy, int dimensions, int maxInputChars,
            int maxBatchSize) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (dimensions <= 0) {
            throw new ConfigurationException("Embedding dimensions must be positive");
        }
        if (maxInputChars <= 0 || maxBatchSize <= 0) {
            throw new ConfigurationException("Embedding input limits must be positive");
        }
        this.dimensions = dimensions;
        this.maxInputChars = maxInputChars;
        this.maxBatchSize = maxBatchSize;
    }

    public boolean isAvailable() {
        return provider.isAvailable();
    }

    public int dimensions() {
        return dimensions;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public int maxInputChars() {
        return maxInputChars;
    }

    /**
     * @return {@code true} if the text passes the input validation of
     *         {@link #embedOne(String)}
     */
    public boolean accepts(String text) {
        return text != null && !text.isBlank() && text.length() <= maxInputChars;
    }

    public float[] embedOne(String text) {
        return tryEmbedOne(text).orElseThrow();
    }

    public List<float[]> embedBatch(List<String> texts) {
        return tryEmbedBatch(texts).orElseThrow();
    }

    /**
     * Embeds a single text.
     *
     * @throws ValidationException if the text is blank or longer than the
     *                             configured maximum; no call is issued then
     */
    public ServiceOutcome<float[]> tryEmbedOne(String text) {
        validateText(text);
        return call(List.of(text)).map(vectors -> vectors.get(0));
    }

    /**
     * Embeds all texts in a single round trip.
     *
     * @throws ValidationException if the batch is too large or one of the texts
     *                             is invalid; no call is issued then
     */
    public ServiceOutcome<List<float[]>> tryEmbedBatch(List<String> texts) {
        if (texts == null) {
            throw new ValidationException("Texts to embed must not be null");
        }
        if (texts.size() > maxBatchSize) {
            throw new ValidationException(
                    "Embedding batch of " + texts.size() + " exceeds the maximum of " + maxBatchSize);
        }
        texts.forEach(this::validateText);
        if (texts.isEmpty()) {
            return ServiceOutcome.success(List.of(), 0);
        }
        return call(List.copyOf(texts));
    }

    private ServiceOutcome<List<float[]>> call(List<String> texts) {
        if (!provider.isAvailable()) {
            return ServiceOutcome.failure(new PermanentServiceException(UnavailableEmbeddingProvider.NOT_CONFIGURED), 0);
        }
        ServiceOutcome<List<float[]>> outcome = retryPolicy.execute("Embedding batch of " + texts.size(),
                () -> checked(provider.embedAll(texts), texts.size()));
        if (outcome.isSuccess()) {
            LOGGER.debug("Embedded {} text(s) in {} attempt(s)", texts.size(), outcome.attempts());
        }
        return outcome;
    }

    private List<float[]> checked(List<float[]> vectors, int expected) {
        if (vectors == null || vectors.size() != expected) {
            throw new PermanentServiceException("Embedding service returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + expected + " texts");
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != dimensions) {
                throw new PermanentServiceException("Embedding dimension mismatch: expected " + dimensions
                        + ", got " + (vector == null ? 0 : vector.length));
            }
        }
        return List.copyOf(vectors);
    }

    private void validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Text to embed must not be empty");
        }
        if (text.length() > maxInputChars) {
            throw new ValidationException(
                    "Text of " + text.length() + " characters exceeds the maximum of " + maxInputChars);
        }
    }
}
