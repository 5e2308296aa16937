package io.cadence4j.ratelimit;

/**
 * Read-only view of a key.
 *
 * @param remaining     admissions left in the live window (the full limit when none is live)
 * @param resetTime     epoch millis at which the live window ends, or now when none is live
 * @param totalRequests admission checks since the key was created or last {@code reset}
 */
public record RateLimitStatus(
        int remaining,
        long resetTime,
        long totalRequests
) {
}
