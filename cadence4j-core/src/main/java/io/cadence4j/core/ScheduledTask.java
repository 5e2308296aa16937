package io.cadence4j.core;

import java.time.Instant;

/**
 * Point-in-time copy of a task owned by the scheduler.
 *
 * @param lastRun start of the most recent run, null if it never ran
 * @param nextRun next due instant
 */
public record ScheduledTask(
        String id,
        String name,
        String schedule,
        boolean enabled,
        Instant lastRun,
        Instant nextRun,
        long runCount,
        long errorCount
) {
}
