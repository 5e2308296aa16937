package io.cadence4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one task run.
 *
 * @param error failure of the run, null on success
 */
public record TaskResult(
        boolean success,
        Instant startedAt,
        Duration duration,
        TaskExecutionException error
) {

    public static TaskResult succeeded(Instant startedAt, Duration duration) {
        return new TaskResult(true, startedAt, duration, null);
    }

    public static TaskResult failed(Instant startedAt, Duration duration, TaskExecutionException error) {
        return new TaskResult(false, startedAt, duration, error);
    }
}
