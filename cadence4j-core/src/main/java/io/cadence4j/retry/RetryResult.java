package io.cadence4j.retry;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of {@link RetryExecutor#executeWithResult}. Exactly one of {@code value}/{@code error}
 * is meaningful: {@code error} is null on success.
 *
 * @param value     result of the successful attempt, may itself be null
 * @param error     last failure when no attempt succeeded
 * @param attempts  attempts actually made, at least 1
 * @param totalTime time spent in attempts and waits
 * @param cancelled true if a cancellation cut the retry loop short
 * @param history   per-attempt records in order
 */
public record RetryResult<T>(
        T value,
        Throwable error,
        int attempts,
        Duration totalTime,
        boolean cancelled,
        List<RetryAttempt> history
) {

    public RetryResult {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean isSuccess() {
        return error == null && !cancelled;
    }
}
