package io.cadence4j.retry;

import io.cadence4j.core.CancellationToken;

import java.time.Duration;

/**
 * Waits between retry attempts. Only the retrying thread waits; the scheduler's dispatch
 * loop and other tasks keep running.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return true if the full duration elapsed, false if {@code token} was cancelled first
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /**
     * Waits on the token, so cancelling it ends the wait immediately.
     */
    static Sleeper cancellable() {
        return (duration, token) -> !token.awaitCancellation(duration);
    }
}
