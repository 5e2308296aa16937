package io.cadence4j.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Quota for one key-class: at most {@code limit} admissions per fixed {@code window}.
 */
public record RateLimitConfig(int limit, Duration window) {

    public RateLimitConfig {
        Objects.requireNonNull(window, "window must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be a positive duration, got: " + window);
        }
    }

    public static RateLimitConfig perMinute(int limit) {
        return new RateLimitConfig(limit, Duration.ofMinutes(1));
    }

    public static RateLimitConfig perSecond(int limit) {
        return new RateLimitConfig(limit, Duration.ofSeconds(1));
    }

    public long windowMs() {
        return window.toMillis();
    }
}
