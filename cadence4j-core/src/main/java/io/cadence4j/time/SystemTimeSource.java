package io.cadence4j.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link TimeSource} backed by a {@link Clock}; the production default.
 */
public class SystemTimeSource extends AbstractTimeSource {

    private final Clock clock;

    public SystemTimeSource() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param timezone IANA time zone id (e.g. "Asia/Taipei"); null means system default
     */
    public SystemTimeSource(String timezone) {
        this(Clock.system(resolveZone(timezone)));
    }

    public SystemTimeSource(Clock clock) {
        super(Objects.requireNonNull(clock, "clock must not be null").getZone());
        this.clock = clock;
    }

    @Override
    protected Instant currentInstant() {
        return clock.instant();
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception ex) {
            throw new IllegalArgumentException("Unknown time zone: " + timezone, ex);
        }
    }
}
