package io.cadence4j.ratelimit;

import io.cadence4j.time.ManualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterRegistryTest {

    private final ManualTimeSource time = new ManualTimeSource(Instant.parse("2026-01-01T00:00:00Z"), "UTC");

    @Test
    void keyClassesShouldHaveTheirOwnQuota() {
        Map<String, RateLimitConfig> configs = new LinkedHashMap<>();
        configs.put("telegram", RateLimitConfig.perMinute(1));
        configs.put("binance", RateLimitConfig.perMinute(2));
        RateLimiterRegistry registry = new RateLimiterRegistry(configs, time);

        assertEquals(Set.of("telegram", "binance"), registry.keyClasses());
        assertTrue(registry.getRequired("telegram").isAllowed("chat-1").allowed());
        assertFalse(registry.getRequired("telegram").isAllowed("chat-1").allowed());
        assertTrue(registry.getRequired("telegram").isAllowed("chat-2").allowed());
        assertTrue(registry.getRequired("binance").isAllowed("chat-1").allowed());
    }

    @Test
    void unknownKeyClassShouldFail() {
        RateLimiterRegistry registry = RateLimiterRegistry.empty(time);

        assertFalse(registry.contains("bybit"));
        assertThrows(IllegalArgumentException.class, () -> registry.getRequired("bybit"));
    }

    @Test
    void blankKeyClassShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RateLimiterRegistry(Map.of(" ", RateLimitConfig.perSecond(1)), time));
    }
}
