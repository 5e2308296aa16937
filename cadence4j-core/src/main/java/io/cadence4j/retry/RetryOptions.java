package io.cadence4j.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry settings for one invocation.
 *
 * <ul>
 *   <li>maxAttempts: total attempts including the first, at least 1</li>
 *   <li>delay: wait before the second attempt</li>
 *   <li>backoffMultiplier: growth factor per failed attempt, at least 1 (1 = constant delay)</li>
 *   <li>maxDelay: cap on a single wait; null means uncapped</li>
 *   <li>retryCondition: errors to retry on; null means retry every error</li>
 *   <li>jitter: random spread in [0, 1); 0.2 scales each wait by a factor in [0.8, 1.2)</li>
 * </ul>
 */
public record RetryOptions(
        int maxAttempts,
        Duration delay,
        double backoffMultiplier,
        Duration maxDelay,
        Predicate<Throwable> retryCondition,
        double jitter
) {

    public RetryOptions {
        Objects.requireNonNull(delay, "delay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, got: " + backoffMultiplier);
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be >= 0, got: " + maxDelay);
        }
        if (Double.isNaN(jitter) || jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
        }
    }

    /**
     * Single attempt, no waiting.
     */
    public static RetryOptions noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Base wait after failed attempt {@code attempt} (1-based), before jitter:
     * {@code delay * backoffMultiplier^(attempt-1)}, capped at {@code maxDelay}.
     */
    public Duration delayAfter(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        double raw = delay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        long ms = raw >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) raw;
        if (maxDelay != null) {
            ms = Math.min(ms, maxDelay.toMillis());
        }
        return Duration.ofMillis(ms);
    }

    public boolean shouldRetry(Throwable error) {
        return retryCondition == null || retryCondition.test(error);
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .delay(delay)
                .backoffMultiplier(backoffMultiplier)
                .maxDelay(maxDelay)
                .retryCondition(retryCondition)
                .jitter(jitter);
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration delay = Duration.ofSeconds(1);
        private double backoffMultiplier = 1.0;
        private Duration maxDelay;
        private Predicate<Throwable> retryCondition;
        private double jitter;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        public Builder delayMillis(long delayMs) {
            return delay(Duration.ofMillis(delayMs));
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryCondition(Predicate<Throwable> retryCondition) {
            this.retryCondition = retryCondition;
            return this;
        }

        /**
         * Retry only when the failure is an instance of one of {@code types}.
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            Objects.requireNonNull(types, "types must not be null");
            this.retryCondition = error -> {
                for (Class<? extends Throwable> type : types) {
                    if (type.isInstance(error)) {
                        return true;
                    }
                }
                return false;
            };
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(maxAttempts, delay, backoffMultiplier, maxDelay, retryCondition, jitter);
        }
    }
}
