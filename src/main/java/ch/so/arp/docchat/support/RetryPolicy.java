package ch.so.arp.docchat.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docchat.error.ConfigurationException;
import ch.so.arp.docchat.error.ServiceException;
import ch.so.arp.docchat.error.TransientServiceException;

/**
 * Retries calls that fail with a retryable {@link ServiceException} using
 * exponential backoff ({@code baseDelay * 2^attempt}). Non retryable service
 * errors end the loop immediately; any other exception is propagated unchanged.
 * Instances hold no mutable state and can be shared between threads.
 */
public final class RetryPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        this(maxRetries, baseDelay, Sleeper.THREAD_SLEEP);
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new ConfigurationException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new ConfigurationException("baseDelay must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    /**
     * Upper bound of the time spent sleeping when every attempt fails.
     */
    public Duration maxTotalDelay() {
        return baseDelay.multipliedBy((1L << (maxRetries + 1)) - 1);
    }

    public <T> ServiceOutcome<T> execute(String operation, Supplier<T> call) {
        for (int retry = 0;; retry++) {
            int attempts = retry + 1;
            try {
                return ServiceOutcome.success(call.get(), attempts);
            } catch (ServiceException ex) {
                if (!ex.isRetryable()) {
                    LOGGER.debug("{} failed permanently after {} attempt(s): {}", operation, attempts, ex.getMessage());
                    return ServiceOutcome.failure(ex, attempts);
                }
                if (retry >= maxRetries) {
                    LOGGER.warn("{} failed after {} attempt(s), giving up: {}", operation, attempts, ex.getMessage());
                    return ServiceOutcome.failure(ex, attempts);
                }
                Duration delay = baseDelay.multipliedBy(1L << retry);
                LOGGER.warn("{} attempt {} failed, retrying in {} ms: {}", operation, attempts, delay.toMillis(),
                        ex.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return ServiceOutcome.failure(
                            new TransientServiceException(operation + " interrupted during backoff", interrupted),
                            attempts);
                }
            }
        }
    }
}
