package io.cadence4j;

import io.cadence4j.core.CancellationToken;

/**
 * A unit of work fired by the {@link TaskScheduler}.
 *
 * <p>Any exception counts as a failed run. Long-running work should poll
 * {@code token} and return early once the scheduler is stopping.
 */
@FunctionalInterface
public interface TaskWork {

    void run(CancellationToken token) throws Exception;
}
