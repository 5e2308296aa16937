package io.cadence4j.cron;

import io.cadence4j.time.TimeSource;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.BitSet;
import java.util.Date;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Parses cron expressions and computes their next fire time.
 *
 * <p>Supported formats:
 * <ul>
 *   <li>5 fields: {@code minute hour day-of-month month day-of-week} (seconds fixed at 0)</li>
 *   <li>6 fields: a leading {@code second} field followed by the five above</li>
 *   <li>Macros: {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly},
 *       {@code @daily}, {@code @midnight}, {@code @hourly}</li>
 * </ul>
 * Each field accepts {@code *}, numbers, ranges {@code a-b}, steps {@code x/n} and comma lists.
 * Months accept JAN-DEC, days of week SUN-SAT; day-of-week 0 and 7 both mean Sunday.
 *
 * <p>The engine keeps no task state: {@link #next(CronSchedule, Instant)} is a pure function of
 * the schedule and the reference instant, evaluated in the engine's zone.
 */
public class CronEngine {

    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    // longest month that may contain a given day, Feb counted as 29 for leap years
    private static final int[] MAX_DAYS = {0, 31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    private final ZoneId zone;

    public CronEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public CronEngine(TimeSource timeSource) {
        this(ZoneId.of(Objects.requireNonNull(timeSource, "timeSource must not be null").getTimezone()));
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Parses and validates {@code expression}.
     *
     * @throws ScheduleParseException if the expression is malformed or can never fire
     */
    public CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleParseException(String.valueOf(expression), "expression must not be empty");
        }
        String s = expression.trim();
        String expanded = s.startsWith("@") ? MACROS.get(s.toLowerCase(Locale.ROOT)) : s;
        if (expanded == null) {
            throw new ScheduleParseException(expression, "unknown macro " + s);
        }

        String[] parts = expanded.split("\\s+");
        String[] six;
        if (parts.length == 5) {
            six = new String[]{"0", parts[0], parts[1], parts[2], parts[3], parts[4]};
        } else if (parts.length == 6) {
            six = parts;
        } else {
            throw new ScheduleParseException(expression, "expected 5 or 6 fields but found " + parts.length);
        }

        Map<CronField, BitSet> values = new EnumMap<>(CronField.class);
        CronField[] fields = CronField.values();
        for (int i = 0; i < fields.length; i++) {
            values.put(fields[i], parseField(expression, fields[i], six[i]));
        }

        CronSchedule schedule = new CronSchedule(s, values);
        ensureCanFire(expression, schedule);
        return schedule;
    }

    /**
     * Returns true if {@code expression} parses.
     */
    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleParseException ex) {
            return false;
        }
    }

    public Instant next(String expression, Instant reference) {
        return next(parse(expression), reference);
    }

    /**
     * Earliest instant strictly after {@code reference} that matches {@code schedule}.
     */
    public Instant next(CronSchedule schedule, Instant reference) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        boolean domRestricted = schedule.isRestricted(CronField.DAY_OF_MONTH);
        boolean dowRestricted = schedule.isRestricted(CronField.DAY_OF_WEEK);

        Instant next;
        if (domRestricted && dowRestricted) {
            next = earlierOf(
                    quartzNext(schedule.quartzDayOfMonthExpression(), reference),
                    quartzNext(schedule.quartzDayOfWeekExpression(), reference));
        } else if (dowRestricted) {
            next = quartzNext(schedule.quartzDayOfWeekExpression(), reference);
        } else {
            next = quartzNext(schedule.quartzDayOfMonthExpression(), reference);
        }

        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + schedule.expression());
        }
        return next;
    }

    private Instant quartzNext(String quartzCron, Instant reference) {
        CronExpression exp;
        try {
            exp = new CronExpression(quartzCron);
        } catch (ParseException ex) {
            // the normalized form is generated from validated fields
            throw new IllegalStateException("Normalized cron rejected by Quartz: " + quartzCron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        Date nextDate = exp.getNextValidTimeAfter(Date.from(reference));
        return nextDate == null ? null : nextDate.toInstant();
    }

    private static Instant earlierOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static BitSet parseField(String expression, CronField field, String text) {
        BitSet bits = new BitSet(field.max() + 1);
        for (String part : text.split(",", -1)) {
            if (part.isEmpty()) {
                throw new ScheduleParseException(expression, "empty list element in " + field.label() + " field '" + text + "'");
            }
            parsePart(expression, field, part, bits);
        }
        if (field == CronField.DAY_OF_WEEK && bits.get(7)) {
            bits.clear(7);
            bits.set(0);
        }
        return bits;
    }

    private static void parsePart(String expression, CronField field, String part, BitSet bits) {
        String rangePart = part;
        int step = 1;

        int slash = part.indexOf('/');
        if (slash >= 0) {
            rangePart = part.substring(0, slash);
            String stepText = part.substring(slash + 1);
            step = parseNumber(expression, field, stepText, "step");
            if (step <= 0) {
                throw new ScheduleParseException(expression, "step must be positive in " + field.label() + " field '" + part + "'");
            }
        }

        int from;
        int to;
        if ("*".equals(rangePart)) {
            from = field.min();
            to = field == CronField.DAY_OF_WEEK ? 6 : field.max();
        } else {
            int dash = rangePart.indexOf('-');
            if (dash >= 0) {
                from = parseValue(expression, field, rangePart.substring(0, dash));
                to = parseValue(expression, field, rangePart.substring(dash + 1));
                if (from > to) {
                    throw new ScheduleParseException(expression,
                            "range start is after range end in " + field.label() + " field '" + part + "'");
                }
            } else {
                from = parseValue(expression, field, rangePart);
                // "5/15" means every 15 starting at 5
                to = slash >= 0 ? (field == CronField.DAY_OF_WEEK ? 6 : field.max()) : from;
            }
        }

        for (int v = from; v <= to; v += step) {
            bits.set(v);
        }
    }

    private static int parseValue(String expression, CronField field, String text) {
        if (text.isEmpty()) {
            throw new ScheduleParseException(expression, "missing value in " + field.label() + " field");
        }
        int named = field.valueOfName(text);
        int value = named >= 0 ? named : parseNumber(expression, field, text, "value");
        if (value < field.min() || value > field.max()) {
            throw new ScheduleParseException(expression,
                    field.label() + " value " + value + " out of range " + field.min() + "-" + field.max());
        }
        return value;
    }

    private static int parseNumber(String expression, CronField field, String text, String what) {
        if (!text.matches("\\d{1,9}")) {
            throw new ScheduleParseException(expression, "invalid " + what + " '" + text + "' in " + field.label() + " field");
        }
        return Integer.parseInt(text);
    }

    // Only day-of-month restrictions can make an expression unsatisfiable (e.g. "0 0 30 2 *").
    private static void ensureCanFire(String expression, CronSchedule schedule) {
        if (schedule.isRestricted(CronField.DAY_OF_WEEK) && schedule.isRestricted(CronField.DAY_OF_MONTH)) {
            return;
        }
        for (int month = 1; month <= 12; month++) {
            if (!schedule.allows(CronField.MONTH, month)) {
                continue;
            }
            for (int day = 1; day <= MAX_DAYS[month]; day++) {
                if (schedule.allows(CronField.DAY_OF_MONTH, day)) {
                    return;
                }
            }
        }
        throw new ScheduleParseException(expression, "day-of-month never occurs in the selected months");
    }
}
