package io.cadence4j.retry;

import io.cadence4j.core.CancellationToken;
import io.cadence4j.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Default {@link RetryExecutor}: attempts run on the calling thread and waits go through a
 * {@link Sleeper} that observes the caller's {@link CancellationToken}.
 *
 * <p>Wait before attempt {@code i+1}: {@code delay * backoffMultiplier^(i-1)}, capped at
 * {@code maxDelay}, then scaled by a random factor in {@code [1-jitter, 1+jitter)} and capped again.
 */
public class DefaultRetryExecutor implements RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(DefaultRetryExecutor.class);

    private final TimeSource timeSource;
    private final Sleeper sleeper;

    public DefaultRetryExecutor(TimeSource timeSource) {
        this(timeSource, Sleeper.cancellable());
    }

    public DefaultRetryExecutor(TimeSource timeSource, Sleeper sleeper) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public <T> T execute(Callable<T> operation, RetryOptions options, CancellationToken token) throws RetryExhaustedException {
        Outcome<T> outcome = run(operation, options, token);
        switch (outcome.stop) {
            case SUCCEEDED:
                return outcome.value;
            case CANCELLED:
                CancellationException cancelled = new CancellationException(
                        "retry cancelled after " + outcome.attempts() + " attempt(s)");
                if (outcome.lastError != null) {
                    cancelled.initCause(outcome.lastError);
                }
                throw cancelled;
            case NOT_RETRYABLE:
                throw new RetryExhaustedException(
                        "Attempt " + outcome.attempts() + " failed with a non-retryable error: " + describe(outcome.lastError),
                        outcome.lastError, outcome.attempts(), outcome.history);
            default:
                throw new RetryExhaustedException(
                        "All " + outcome.attempts() + " attempt(s) failed, last error: " + describe(outcome.lastError),
                        outcome.lastError, outcome.attempts(), outcome.history);
        }
    }

    @Override
    public <T> RetryResult<T> executeWithResult(Callable<T> operation, RetryOptions options, CancellationToken token) {
        Outcome<T> outcome = run(operation, options, token);
        return new RetryResult<>(
                outcome.value,
                outcome.stop == Stop.SUCCEEDED ? null : outcome.lastError,
                outcome.attempts(),
                outcome.totalTime,
                outcome.stop == Stop.CANCELLED,
                outcome.history
        );
    }

    /**
     * Wait after failed attempt {@code attempt}, jitter applied.
     */
    protected Duration computeDelay(RetryOptions options, int attempt) {
        Duration base = options.delayAfter(attempt);
        if (options.jitter() == 0.0 || base.isZero()) {
            return base;
        }
        double factor = ThreadLocalRandom.current().nextDouble(1.0 - options.jitter(), 1.0 + options.jitter());
        long ms = (long) (base.toMillis() * factor);
        if (options.maxDelay() != null) {
            ms = Math.min(ms, options.maxDelay().toMillis());
        }
        return Duration.ofMillis(Math.max(0L, ms));
    }

    private <T> Outcome<T> run(Callable<T> operation, RetryOptions options, CancellationToken token) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(token, "token must not be null");

        long startedAt = timeSource.now();
        List<RetryAttempt> history = new ArrayList<>(options.maxAttempts());
        Throwable lastError = null;
        Stop stop = Stop.EXHAUSTED;

        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            long attemptStart = timeSource.now();
            try {
                T value = operation.call();
                history.add(new RetryAttempt(attempt, null, elapsedSince(attemptStart)));
                return new Outcome<>(Stop.SUCCEEDED, value, null, history, elapsedSince(startedAt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                history.add(new RetryAttempt(attempt, e, elapsedSince(attemptStart)));
                lastError = e;
                stop = Stop.CANCELLED;
                break;
            } catch (Exception e) {
                history.add(new RetryAttempt(attempt, e, elapsedSince(attemptStart)));
                lastError = e;
            }

            if (attempt == options.maxAttempts()) {
                break;
            }
            if (!options.shouldRetry(lastError)) {
                stop = Stop.NOT_RETRYABLE;
                break;
            }
            if (token.isCancelled()) {
                stop = Stop.CANCELLED;
                break;
            }

            Duration wait = computeDelay(options, attempt);
            log.warn("retry attempt={}/{} failed; next attempt in {}ms msg={}",
                    attempt, options.maxAttempts(), wait.toMillis(), lastError.getMessage());
            try {
                if (!sleeper.sleep(wait, token)) {
                    stop = Stop.CANCELLED;
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop = Stop.CANCELLED;
                break;
            }
        }

        if (stop == Stop.CANCELLED) {
            log.info("retry loop cancelled after attempts={}", history.size());
        }
        return new Outcome<>(stop, null, lastError, history, elapsedSince(startedAt));
    }

    private Duration elapsedSince(long startMs) {
        return Duration.ofMillis(Math.max(0L, timeSource.now() - startMs));
    }

    private static String describe(Throwable error) {
        return error == null ? "none" : error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private enum Stop {
        SUCCEEDED,
        EXHAUSTED,
        NOT_RETRYABLE,
        CANCELLED
    }

    private static final class Outcome<T> {
        private final Stop stop;
        private final T value;
        private final Throwable lastError;
        private final List<RetryAttempt> history;
        private final Duration totalTime;

        private Outcome(Stop stop, T value, Throwable lastError, List<RetryAttempt> history, Duration totalTime) {
            this.stop = stop;
            this.value = value;
            this.lastError = lastError;
            this.history = history;
            this.totalTime = totalTime;
        }

        int attempts() {
            return history.size();
        }
    }
}
