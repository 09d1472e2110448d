package ch.so.arp.docchat.support;

import java.util.Objects;
import java.util.function.Function;

import ch.so.arp.docchat.error.ServiceException;

/**
 * Result of a call against an external service after the retry policy has been
 * applied. Orchestrators inspect the outcome to decide whether to degrade or to
 * propagate the failure.
 *
 * @param <T> type of the successful value
 */
public sealed interface ServiceOutcome<T> permits ServiceOutcome.Success, ServiceOutcome.Failure {

    /**
     * @return number of calls that were issued, including the last one
     */
    int attempts();

    boolean isSuccess();

    /**
     * Returns the value of a successful outcome or throws the recorded error.
     */
    T orElseThrow();

    /**
     * Transforms the value of a successful outcome, keeping the attempt count.
     */
    <R> ServiceOutcome<R> map(Function<? super T, ? extends R> mapper);

    static <T> ServiceOutcome<T> success(T value, int attempts) {
        return new Success<>(value, attempts);
    }

    static <T> ServiceOutcome<T> failure(ServiceException error, int attempts) {
        return new Failure<>(error, attempts);
    }

    record Success<T>(T value, int attempts) implements ServiceOutcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <R> ServiceOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), attempts);
        }
    }

    record Failure<T>(ServiceException error, int attempts) implements ServiceOutcome<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T orElseThrow() {
            throw error;
        }

        @Override
        public <R> ServiceOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error, attempts);
        }
    }
}
