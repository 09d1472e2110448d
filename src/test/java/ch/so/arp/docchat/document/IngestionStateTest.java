package ch.so.arp.docchat.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class IngestionStateTest {

    @Test
    void followsTheIngestionLifecycle() {
        IngestionState state = IngestionState.UPLOADED
                .transitionTo(IngestionState.CHUNKED)
                .transitionTo(IngestionState.EMBEDDED_PARTIALLY)
                .transitionTo(IngestionState.INDEXED);

        assertThat(state).isEqualTo(IngestionState.INDEXED);
    }

    @ParameterizedTest
    @EnumSource(value = IngestionState.class, names = "DELETED", mode = EnumSource.Mode.EXCLUDE)
    void allowsDeletionFromEveryState(IngestionState state) {
        assertThat(state.canTransitionTo(IngestionState.DELETED)).isTrue();
    }

    @Test
    void rejectsSkippingSteps() {
        assertThatThrownBy(() -> IngestionState.UPLOADED.transitionTo(IngestionState.INDEXED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> IngestionState.INDEXED.transitionTo(IngestionState.CHUNKED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> IngestionState.DELETED.transitionTo(IngestionState.DELETED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void derivesEmbeddingStateFromCounts() {
        assertThat(IngestionState.afterEmbedding(0, 3)).isEqualTo(IngestionState.EMBEDDING_SKIPPED);
        assertThat(IngestionState.afterEmbedding(2, 3)).isEqualTo(IngestionState.EMBEDDED_PARTIALLY);
        assertThat(IngestionState.afterEmbedding(3, 3)).isEqualTo(IngestionState.EMBEDDED_FULLY);
        assertThat(IngestionState.afterEmbedding(0, 0)).isEqualTo(IngestionState.EMBEDDING_SKIPPED);
    }
}
