package io.cadence4j.ratelimit;

import io.cadence4j.time.TimeSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window {@link RateLimiter}.
 *
 * <p>Each key owns a window {@code [windowStart, windowStart + windowMs)}. The first request after
 * the window expires opens a new one at the current time. Updates lock only the key being
 * touched, so unrelated keys never contend.
 *
 * <p>Keys are never evicted; use bounded key spaces such as exchange or chat ids.
 */
public class FixedWindowRateLimiter implements RateLimiter {

    private final RateLimitConfig config;
    private final TimeSource timeSource;
    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(RateLimitConfig config, TimeSource timeSource) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    public RateLimitConfig config() {
        return config;
    }

    @Override
    public RateLimitResult isAllowed(String key) {
        Window window = windowFor(key);
        synchronized (window) {
            long now = timeSource.now();
            if (!window.isLive(now, config.windowMs())) {
                window.open(now);
            }
            window.count++;
            window.totalRequests++;

            int limit = config.limit();
            long resetTime = window.start + config.windowMs();
            boolean allowed = window.count <= limit;
            int remaining = (int) Math.max(0, limit - window.count);
            Duration retryAfter = allowed ? null : Duration.ofMillis(resetTime - now);
            return new RateLimitResult(allowed, remaining, resetTime, retryAfter);
        }
    }

    @Override
    public void reset(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Window window = windows.get(key);
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.clear();
        }
    }

    @Override
    public RateLimitStatus getStatus(String key) {
        Objects.requireNonNull(key, "key must not be null");
        long now = timeSource.now();
        Window window = windows.get(key);
        if (window == null) {
            return new RateLimitStatus(config.limit(), now, 0);
        }
        synchronized (window) {
            if (!window.isLive(now, config.windowMs())) {
                return new RateLimitStatus(config.limit(), now, window.totalRequests);
            }
            int remaining = (int) Math.max(0, config.limit() - window.count);
            return new RateLimitStatus(remaining, window.start + config.windowMs(), window.totalRequests);
        }
    }

    private Window windowFor(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return windows.computeIfAbsent(key, k -> new Window());
    }

    /**
     * Mutable per-key state; every access holds the instance monitor.
     */
    private static final class Window {
        private boolean open;
        private long start;
        private long count;
        private long totalRequests;

        boolean isLive(long now, long windowMs) {
            return open && now - start < windowMs;
        }

        void open(long now) {
            open = true;
            start = now;
            count = 0;
        }

        void clear() {
            open = false;
            start = 0;
            count = 0;
            totalRequests = 0;
        }
    }
}
