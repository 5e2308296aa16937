package io.cadence4j.ratelimit;

import io.cadence4j.time.ManualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixedWindowRateLimiterTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private final ManualTimeSource time = new ManualTimeSource(START, "UTC");
    private final FixedWindowRateLimiter limiter =
            new FixedWindowRateLimiter(new RateLimitConfig(3, Duration.ofSeconds(1)), time);

    @Test
    void requestsBeyondLimitShouldBeDeniedWithRetryAfter() {
        long windowEnd = START.toEpochMilli() + 1000;

        int previousRemaining = Integer.MAX_VALUE;
        for (int i = 0; i < 3; i++) {
            RateLimitResult result = limiter.isAllowed("binance");
            assertTrue(result.allowed());
            assertTrue(result.remaining() < previousRemaining);
            assertEquals(windowEnd, result.resetTime());
            assertNull(result.retryAfter());
            previousRemaining = result.remaining();
        }
        assertEquals(0, previousRemaining);

        time.advanceMillis(400);
        RateLimitResult denied = limiter.isAllowed("binance");

        assertFalse(denied.allowed());
        assertEquals(0, denied.remaining());
        assertEquals(windowEnd, denied.resetTime());
        assertEquals(Duration.ofMillis(600), denied.retryAfter());
    }

    @Test
    void exhaustedKeyShouldBeAdmittedAgainAfterWindow() {
        for (int i = 0; i < 4; i++) {
            limiter.isAllowed("binance");
        }

        time.advance(Duration.ofSeconds(1));
        RateLimitResult result = limiter.isAllowed("binance");

        assertTrue(result.allowed());
        assertEquals(2, result.remaining());
        assertEquals(START.toEpochMilli() + 2000, result.resetTime());
    }

    @Test
    void keysShouldBeIndependent() {
        for (int i = 0; i < 4; i++) {
            limiter.isAllowed("binance");
        }

        RateLimitResult other = limiter.isAllowed("bybit");

        assertTrue(other.allowed());
        assertEquals(2, other.remaining());
    }

    @Test
    void statusShouldKeepLifetimeCountAcrossWindows() {
        for (int i = 0; i < 4; i++) {
            limiter.isAllowed("telegram");
        }
        time.advance(Duration.ofMillis(1500));
        limiter.isAllowed("telegram");

        RateLimitStatus status = limiter.getStatus("telegram");

        assertEquals(5, status.totalRequests());
        assertEquals(2, status.remaining());
        assertEquals(START.toEpochMilli() + 2500, status.resetTime());
    }

    @Test
    void statusOfUnknownOrExpiredKeyShouldReportFullQuota() {
        RateLimitStatus unknown = limiter.getStatus("webhook");
        assertEquals(3, unknown.remaining());
        assertEquals(time.now(), unknown.resetTime());
        assertEquals(0, unknown.totalRequests());

        limiter.isAllowed("webhook");
        time.advance(Duration.ofSeconds(5));
        RateLimitStatus expired = limiter.getStatus("webhook");
        assertEquals(3, expired.remaining());
        assertEquals(1, expired.totalRequests());
    }

    @Test
    void resetShouldClearWindowAndLifetimeCount() {
        for (int i = 0; i < 4; i++) {
            limiter.isAllowed("binance");
        }

        limiter.reset("binance");

        assertEquals(0, limiter.getStatus("binance").totalRequests());
        RateLimitResult result = limiter.isAllowed("binance");
        assertTrue(result.allowed());
        assertEquals(2, result.remaining());
    }

    @Test
    void concurrentCallersShouldNeverExceedLimit() throws Exception {
        FixedWindowRateLimiter shared = new FixedWindowRateLimiter(new RateLimitConfig(500, Duration.ofMinutes(1)), time);
        int threads = 8;
        int callsPerThread = 1000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        if (shared.isAllowed("exchange").allowed()) {
                            admitted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(500, admitted.get());
        assertEquals((long) threads * callsPerThread, shared.getStatus("exchange").totalRequests());
    }

    @Test
    void configShouldRejectNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitConfig(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitConfig(1, Duration.ZERO));
        assertEquals(Duration.ofMinutes(1), RateLimitConfig.perMinute(20).window());
    }
}
