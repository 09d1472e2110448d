package ch.so.arp.docchat.document;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Embedding state of a chunk: either a vector of the deployment dimension or
 * explicitly absent. Consumers go through {@link #fold(Function, Supplier)} so
 * that the unembedded case cannot be forgotten.
 */
public sealed interface ChunkEmbedding permits ChunkEmbedding.Embedded, ChunkEmbedding.Unembedded {

    static ChunkEmbedding of(float[] vector) {
        return new Embedded(vector);
    }

    static ChunkEmbedding none() {
        return Unembedded.INSTANCE;
    }

    <R> R fold(Function<float[], R> embedded, Supplier<R> unembedded);

    boolean isEmbedded();

    /**
     * @return the vector length, {@code 0} when unembedded
     */
    int dimensions();

    final class Embedded implements ChunkEmbedding {

        private final float[] vector;

        private Embedded(float[] vector) {
            Objects.requireNonNull(vector, "vector");
            if (vector.length == 0) {
                throw new IllegalArgumentException("embedding vector must not be empty");
            }
            this.vector = vector.clone();
        }

        public float[] vector() {
            return vector.clone();
        }

        @Override
        public <R> R fold(Function<float[], R> embedded, Supplier<R> unembedded) {
            return embedded.apply(vector.clone());
        }

        @Override
        public boolean isEmbedded() {
            return true;
        }

        @Override
        public int dimensions() {
            return vector.length;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Embedded that && Arrays.equals(vector, that.vector);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(vector);
        }

        @Override
        public String toString() {
            return "Embedded[dimensions=" + vector.length + "]";
        }
    }

    final class Unembedded implements ChunkEmbedding {

        private static final Unembedded INSTANCE = new Unembedded();

        private Unembedded() {
        }

        @Override
        public <R> R fold(Function<float[], R> embedded, Supplier<R> unembedded) {
            return unembedded.get();
        }

        @Override
        public boolean isEmbedded() {
            return false;
        }

        @Override
        public int dimensions() {
            return 0;
        }

        @Override
        public String toString() {
            return "Unembedded";
        }
    }
}
