package io.cadence4j.retry;

import java.util.List;

/**
 * All permitted attempts of an operation failed, or the retry condition rejected a failure.
 * The cause is the last failure.
 */
public class RetryExhaustedException extends Exception {

    private final int attempts;
    private final transient List<RetryAttempt> history;

    public RetryExhaustedException(String message, Throwable lastError, int attempts, List<RetryAttempt> history) {
        super(message, lastError);
        this.attempts = attempts;
        this.history = history == null ? List.of() : List.copyOf(history);
    }

    public int getAttempts() {
        return attempts;
    }

    public List<RetryAttempt> getHistory() {
        return history;
    }

    public Throwable getLastError() {
        return getCause();
    }
}
