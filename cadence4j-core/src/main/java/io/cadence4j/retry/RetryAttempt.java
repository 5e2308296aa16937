package io.cadence4j.retry;

import java.time.Duration;

/**
 * One try of an operation.
 *
 * @param attempt 1-based attempt index
 * @param error   failure of this attempt, null if it succeeded
 * @param elapsed time spent in the operation (waits excluded)
 */
public record RetryAttempt(int attempt, Throwable error, Duration elapsed) {

    public boolean succeeded() {
        return error == null;
    }
}
