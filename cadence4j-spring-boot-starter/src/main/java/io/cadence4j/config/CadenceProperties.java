package io.cadence4j.config;

import io.cadence4j.ratelimit.RateLimitConfig;
import io.cadence4j.retry.RetryOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot binding for the {@code cadence.*} namespace.
 */
@ConfigurationProperties(prefix = "cadence")
public class CadenceProperties {
    private boolean enabled = true;

    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();

    private Retry retry = new Retry();

    /**
     * Rate limits per key-class, e.g. {@code cadence.rate-limits.exchange.limit=10}.
     */
    private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Map<String, RateLimit> getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(Map<String, RateLimit> rateLimits) {
        this.rateLimits = rateLimits;
    }

    public Map<String, RateLimitConfig> toRateLimitConfigs() {
        Map<String, RateLimitConfig> configs = new LinkedHashMap<>();
        rateLimits.forEach((keyClass, rateLimit) -> configs.put(keyClass, rateLimit.toConfig(keyClass)));
        return configs;
    }

    /**
     * Retry options applied to registered tasks that set none. A single attempt (the default)
     * leaves such tasks unwrapped.
     */
    public static class Retry {
        private int maxAttempts = 1;
        private Duration delay = Duration.ofSeconds(1);
        private double backoffMultiplier = 1.0;
        private Duration maxDelay; // null = uncapped
        private double jitter = 0.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public RetryOptions toRetryOptions() {
            return RetryOptions.builder()
                    .maxAttempts(maxAttempts)
                    .delay(delay)
                    .backoffMultiplier(backoffMultiplier)
                    .maxDelay(maxDelay)
                    .jitter(jitter)
                    .build();
        }
    }

    public static class RateLimit {
        private int limit;
        private Duration window = Duration.ofMinutes(1);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        RateLimitConfig toConfig(String keyClass) {
            try {
                return new RateLimitConfig(limit, window);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("cadence.rate-limits." + keyClass + ": " + e.getMessage(), e);
            }
        }
    }
}
