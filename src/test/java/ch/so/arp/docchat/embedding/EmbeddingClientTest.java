package ch.so.arp.docchat.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.TransientServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.support.RetryPolicy;
import ch.so.arp.docchat.support.ServiceOutcome;

class EmbeddingClientTest {

    private static final int DIMENSIONS = 4;

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofMillis(100), sleeps::add);

    @Test
    void rejectsOversizedTextWithoutCallingTheService() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient client = client(texts -> {
            calls.incrementAndGet();
            return vectors(texts.size());
        });

        assertThatThrownBy(() -> client.embedOne("x".repeat(51))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> client.tryEmbedOne("x".repeat(51))).isInstanceOf(ValidationException.class);
        assertThat(calls).hasValue(0);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void rejectsEmptyText() {
        EmbeddingClient client = client(texts -> vectors(texts.size()));

        assertThatThrownBy(() -> client.embedOne("  ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> client.embedBatch(List.of("fine", ""))).isInstanceOf(ValidationException.class);
        assertThat(client.accepts("fine")).isTrue();
        assertThat(client.accepts(" ")).isFalse();
    }

    @Test
    void rejectsBatchesAboveTheConfiguredSize() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient client = client(texts -> {
            calls.incrementAndGet();
            return vectors(texts.size());
        });

        assertThatThrownBy(() -> client.embedBatch(List.of("a", "b", "c", "d")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maximum of 3");
        assertThat(calls).hasValue(0);
    }

    @Test
    void returnsOneVectorPerTextInOrder() {
        EmbeddingClient client = client(texts -> texts.stream()
                .map(text -> new float[] { text.length(), 0f, 0f, 0f })
                .toList());

        List<float[]> vectors = client.embedBatch(List.of("a", "bb", "ccc"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors).extracting(vector -> vector[0]).containsExactly(1f, 2f, 3f);
        assertThat(client.embedBatch(List.of())).isEmpty();
    }

    @Test
    void retriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient client = client(texts -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientServiceException("rate limited");
            }
            return vectors(texts.size());
        });

        ServiceOutcome<float[]> outcome = client.tryEmbedOne("remote work");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.orElseThrow()).hasSize(DIMENSIONS);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void reportsDimensionMismatchAsPermanentFailure() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingClient client = client(texts -> {
            calls.incrementAndGet();
            return List.of(new float[] { 1f, 2f });
        });

        ServiceOutcome<float[]> outcome = client.tryEmbedOne("text");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(calls).hasValue(1);
        assertThatThrownBy(outcome::orElseThrow).isInstanceOf(PermanentServiceException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    void reportsMissingVectorsAsPermanentFailure() {
        EmbeddingClient client = client(texts -> vectors(texts.size() - 1));

        assertThatThrownBy(() -> client.embedBatch(List.of("a", "b")))
                .isInstanceOf(PermanentServiceException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    void failsWithoutCallWhenNoServiceIsConfigured() {
        EmbeddingClient client = new EmbeddingClient(new UnavailableEmbeddingProvider(), retryPolicy, DIMENSIONS, 50,
                3);

        ServiceOutcome<float[]> outcome = client.tryEmbedOne("text");

        assertThat(client.isAvailable()).isFalse();
        assertThat(outcome.attempts()).isZero();
        assertThatThrownBy(outcome::orElseThrow).isInstanceOf(PermanentServiceException.class)
                .hasMessage(UnavailableEmbeddingProvider.NOT_CONFIGURED);
    }

    @Test
    void deterministicProviderProducesStableUnitVectors() {
        EmbeddingClient client = new EmbeddingClient(new DeterministicEmbeddingProvider(DIMENSIONS), retryPolicy,
                DIMENSIONS, 50, 3);

        float[] first = client.embedOne("remote work");
        float[] second = client.embedOne("remote work");

        assertThat(first).containsExactly(second);
        double norm = 0;
        for (float value : first) {
            norm += value * value;
        }
        assertThat(norm).isCloseTo(1.0d, offset(1e-5));
    }

    private EmbeddingClient client(EmbeddingProvider provider) {
        return new EmbeddingClient(provider, retryPolicy, DIMENSIONS, 50, 3);
    }

    private static List<float[]> vectors(int count) {
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            vectors.add(new float[] { 0.5f, 0.5f, 0.5f, 0.5f });
        }
        return vectors;
    }
}
