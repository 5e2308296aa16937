package io.cadence4j.ratelimit;

import io.cadence4j.time.TimeSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One {@link RateLimiter} per key-class ("binance", "telegram", "webhook", ...).
 *
 * <p>Key-classes share a quota configuration; keys inside a class (e.g. a chat id) get
 * independent windows.
 */
public class RateLimiterRegistry {

    private final Map<String, RateLimiter> limitersByClass;

    public RateLimiterRegistry(Map<String, RateLimitConfig> configs, TimeSource timeSource) {
        Objects.requireNonNull(configs, "configs must not be null");
        Objects.requireNonNull(timeSource, "timeSource must not be null");
        Map<String, RateLimiter> limiters = new LinkedHashMap<>();
        configs.forEach((keyClass, config) -> {
            if (keyClass == null || keyClass.isBlank()) {
                throw new IllegalArgumentException("rate limit key-class must not be blank");
            }
            limiters.put(keyClass, new FixedWindowRateLimiter(config, timeSource));
        });
        this.limitersByClass = Collections.unmodifiableMap(limiters);
    }

    public static RateLimiterRegistry empty(TimeSource timeSource) {
        return new RateLimiterRegistry(Map.of(), timeSource);
    }

    public RateLimiter getRequired(String keyClass) {
        RateLimiter limiter = limitersByClass.get(keyClass);
        if (limiter == null) {
            throw new IllegalArgumentException("No rate limit configured for key-class: " + keyClass);
        }
        return limiter;
    }

    public boolean contains(String keyClass) {
        return limitersByClass.containsKey(keyClass);
    }

    public Set<String> keyClasses() {
        return limitersByClass.keySet();
    }
}
