package io.cadence4j.ratelimit;

/**
 * Per-key admission control. A denied request is reported through
 * {@link RateLimitResult#allowed()}, never by an exception, so callers can wait or skip.
 */
public interface RateLimiter {

    /**
     * Counts one request against {@code key} and reports whether it is admitted.
     */
    RateLimitResult isAllowed(String key);

    /**
     * Drops the key's window and lifetime counter.
     */
    void reset(String key);

    RateLimitStatus getStatus(String key);
}
