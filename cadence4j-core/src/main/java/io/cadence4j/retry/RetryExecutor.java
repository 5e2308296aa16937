package io.cadence4j.retry;

import io.cadence4j.core.CancellationToken;

import java.util.concurrent.Callable;

/**
 * Runs an operation, retrying failures per {@link RetryOptions}.
 */
public interface RetryExecutor {

    /**
     * @return the first successful value
     * @throws RetryExhaustedException                  when attempts run out or a failure is not retryable
     * @throws java.util.concurrent.CancellationException when {@code token} is cancelled during a wait
     */
    <T> T execute(Callable<T> operation, RetryOptions options, CancellationToken token) throws RetryExhaustedException;

    default <T> T execute(Callable<T> operation, RetryOptions options) throws RetryExhaustedException {
        return execute(operation, options, CancellationToken.none());
    }

    /**
     * Like {@link #execute} but never throws; the outcome is reported in the result.
     */
    <T> RetryResult<T> executeWithResult(Callable<T> operation, RetryOptions options, CancellationToken token);

    default <T> RetryResult<T> executeWithResult(Callable<T> operation, RetryOptions options) {
        return executeWithResult(operation, options, CancellationToken.none());
    }
}
