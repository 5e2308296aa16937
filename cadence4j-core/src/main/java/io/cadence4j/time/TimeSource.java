package io.cadence4j.time;

import java.time.ZonedDateTime;

/**
 * Clock and calendar arithmetic used by the scheduler, cron engine, rate limiter and retry executor.
 *
 * <p>Nothing in the runtime reads the wall clock directly; swap in {@link ManualTimeSource}
 * to drive scheduling deterministically.
 *
 * <p>Calendar values are {@link ZonedDateTime}s in the zone returned by {@link #getTimezone()}.
 * All methods return new values and never mutate their arguments.
 */
public interface TimeSource {

    /**
     * Default pattern used by {@link #format(ZonedDateTime)} and {@link #parse(String)}:
     * ISO-8601 with milliseconds and offset, e.g. {@code 2026-01-01T09:30:00.000+02:00}.
     */
    String DEFAULT_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX";

    /**
     * Current instant in epoch milliseconds.
     */
    long now();

    /**
     * Current instant as a calendar value in the configured zone.
     */
    ZonedDateTime nowDate();

    String format(ZonedDateTime date);

    String format(ZonedDateTime date, String pattern);

    /**
     * Parses text written in {@link #DEFAULT_FORMAT}.
     *
     * @throws IllegalArgumentException if the text does not match
     */
    ZonedDateTime parse(String text);

    /**
     * Parses text written in {@code pattern}. Values without zone information are read in the
     * configured zone; a pattern without time fields yields the start of that day.
     *
     * @throws IllegalArgumentException if the text does not match
     */
    ZonedDateTime parse(String text, String pattern);

    ZonedDateTime addDays(ZonedDateTime date, long days);

    ZonedDateTime addHours(ZonedDateTime date, long hours);

    ZonedDateTime addMinutes(ZonedDateTime date, long minutes);

    /**
     * Whole minutes in {@code date1 - date2}, truncated toward zero.
     */
    long diffInMinutes(ZonedDateTime date1, ZonedDateTime date2);

    long diffInHours(ZonedDateTime date1, ZonedDateTime date2);

    long diffInDays(ZonedDateTime date1, ZonedDateTime date2);

    /**
     * True for Saturday and Sunday in the configured zone.
     */
    boolean isWeekend(ZonedDateTime date);

    /**
     * Inverse of {@link #isWeekend(ZonedDateTime)}; holidays are not considered.
     */
    boolean isBusinessDay(ZonedDateTime date);

    ZonedDateTime startOfDay(ZonedDateTime date);

    ZonedDateTime endOfDay(ZonedDateTime date);

    /**
     * IANA zone id this source was configured with (e.g. "Europe/Kyiv").
     */
    String getTimezone();
}
