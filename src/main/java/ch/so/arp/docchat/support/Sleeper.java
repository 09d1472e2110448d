package ch.so.arp.docchat.support;

import java.time.Duration;

/**
 * Blocks the current thread for a backoff period. Tests replace the default
 * implementation to observe the requested delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
