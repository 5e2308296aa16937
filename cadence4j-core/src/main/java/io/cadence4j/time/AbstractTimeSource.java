package io.cadence4j.time;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * Calendar arithmetic shared by every {@link TimeSource}. Subclasses only supply the current instant.
 */
public abstract class AbstractTimeSource implements TimeSource {

    private static final DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);

    private final ZoneId zone;

    protected AbstractTimeSource(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * The instant every other method is derived from.
     */
    protected abstract Instant currentInstant();

    @Override
    public long now() {
        return currentInstant().toEpochMilli();
    }

    @Override
    public ZonedDateTime nowDate() {
        return ZonedDateTime.ofInstant(currentInstant(), zone);
    }

    @Override
    public String format(ZonedDateTime date) {
        Objects.requireNonNull(date, "date must not be null");
        return DEFAULT_FORMATTER.format(date.withZoneSameInstant(zone));
    }

    @Override
    public String format(ZonedDateTime date, String pattern) {
        Objects.requireNonNull(date, "date must not be null");
        if (pattern == null || pattern.isBlank()) {
            return format(date);
        }
        return formatter(pattern).format(date.withZoneSameInstant(zone));
    }

    @Override
    public ZonedDateTime parse(String text) {
        return parse(text, DEFAULT_FORMAT);
    }

    @Override
    public ZonedDateTime parse(String text, String pattern) {
        Objects.requireNonNull(text, "text must not be null");
        DateTimeFormatter formatter = (pattern == null || pattern.isBlank())
                ? DEFAULT_FORMATTER
                : formatter(pattern);

        try {
            TemporalAccessor parsed = formatter.parse(text.trim());
            LocalDateTime local = parsed.isSupported(ChronoField.HOUR_OF_DAY)
                    ? LocalDateTime.from(parsed)
                    : LocalDate.from(parsed).atStartOfDay();

            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return ZonedDateTime.of(local, ZoneId.from(parsed)).withZoneSameInstant(zone);
            }
            return ZonedDateTime.of(local, zone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Cannot parse date '" + text + "' with pattern '" + pattern + "'", ex);
        }
    }

    @Override
    public ZonedDateTime addDays(ZonedDateTime date, long days) {
        return Objects.requireNonNull(date, "date must not be null").plusDays(days);
    }

    @Override
    public ZonedDateTime addHours(ZonedDateTime date, long hours) {
        return Objects.requireNonNull(date, "date must not be null").plusHours(hours);
    }

    @Override
    public ZonedDateTime addMinutes(ZonedDateTime date, long minutes) {
        return Objects.requireNonNull(date, "date must not be null").plusMinutes(minutes);
    }

    @Override
    public long diffInMinutes(ZonedDateTime date1, ZonedDateTime date2) {
        return between(date1, date2).toMinutes();
    }

    @Override
    public long diffInHours(ZonedDateTime date1, ZonedDateTime date2) {
        return between(date1, date2).toHours();
    }

    @Override
    public long diffInDays(ZonedDateTime date1, ZonedDateTime date2) {
        return between(date1, date2).toDays();
    }

    @Override
    public boolean isWeekend(ZonedDateTime date) {
        Objects.requireNonNull(date, "date must not be null");
        DayOfWeek day = date.withZoneSameInstant(zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    @Override
    public boolean isBusinessDay(ZonedDateTime date) {
        return !isWeekend(date);
    }

    @Override
    public ZonedDateTime startOfDay(ZonedDateTime date) {
        Objects.requireNonNull(date, "date must not be null");
        return date.withZoneSameInstant(zone).toLocalDate().atStartOfDay(zone);
    }

    @Override
    public ZonedDateTime endOfDay(ZonedDateTime date) {
        return startOfDay(date).plusDays(1).minus(1, ChronoUnit.MILLIS);
    }

    @Override
    public String getTimezone() {
        return zone.getId();
    }

    public ZoneId zone() {
        return zone;
    }

    // Duration keeps the sign and its toX() methods truncate toward zero.
    private static Duration between(ZonedDateTime date1, ZonedDateTime date2) {
        Objects.requireNonNull(date1, "date1 must not be null");
        Objects.requireNonNull(date2, "date2 must not be null");
        return Duration.between(date2.toInstant(), date1.toInstant());
    }

    private static DateTimeFormatter formatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid date pattern: " + pattern, ex);
        }
    }
}
