package io.cadence4j.ratelimit;

import java.time.Duration;

/**
 * Outcome of an admission check.
 *
 * @param allowed    whether the request fits the current window
 * @param remaining  admissions left in the current window, never negative
 * @param resetTime  epoch millis at which the current window ends
 * @param retryAfter time until the window ends; null when allowed
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        long resetTime,
        Duration retryAfter
) {
}
