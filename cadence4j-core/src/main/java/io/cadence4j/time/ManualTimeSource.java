package io.cadence4j.time;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TimeSource} whose clock only moves when told to. Thread-safe.
 *
 * <pre>{@code
 * ManualTimeSource clock = new ManualTimeSource(Instant.parse("2026-01-01T00:00:00Z"), "UTC");
 * clock.advance(Duration.ofMinutes(1));
 * }</pre>
 */
public class ManualTimeSource extends AbstractTimeSource {

    private final AtomicReference<Instant> current;

    public ManualTimeSource(Instant start, String timezone) {
        this(start, SystemTimeSource.resolveZone(timezone));
    }

    public ManualTimeSource(Instant start, ZoneId zone) {
        super(zone);
        this.current = new AtomicReference<>(Objects.requireNonNull(start, "start must not be null"));
    }

    @Override
    protected Instant currentInstant() {
        return current.get();
    }

    public Instant instant() {
        return current.get();
    }

    public void set(Instant instant) {
        current.set(Objects.requireNonNull(instant, "instant must not be null"));
    }

    /**
     * Moves the clock forward; negative durations are rejected.
     */
    public Instant advance(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        return current.updateAndGet(i -> i.plus(duration));
    }

    public Instant advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }
}
