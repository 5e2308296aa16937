package io.cadence4j.cron;

import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed, validated cron expression. Immutable and safe to share.
 *
 * <p>A field is <em>restricted</em> when it does not cover its whole range. Day-of-month and
 * day-of-week are OR'd when both are restricted; otherwise all fields must match.
 */
public final class CronSchedule {

    private final String expression;
    private final Map<CronField, BitSet> values;

    CronSchedule(String expression, Map<CronField, BitSet> values) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        EnumMap<CronField, BitSet> copy = new EnumMap<>(CronField.class);
        values.forEach((field, bits) -> copy.put(field, (BitSet) bits.clone()));
        this.values = copy;
    }

    /**
     * The expression as written at registration.
     */
    public String expression() {
        return expression;
    }

    public boolean isRestricted(CronField field) {
        BitSet bits = values.get(field);
        int span = field == CronField.DAY_OF_WEEK ? 7 : field.max() - field.min() + 1;
        return bits.cardinality() < span;
    }

    public boolean allows(CronField field, int value) {
        return values.get(field).get(value);
    }

    /**
     * Checks the calendar fields of {@code time} (nanoseconds ignored) against this schedule.
     */
    public boolean matches(ZonedDateTime time) {
        Objects.requireNonNull(time, "time must not be null");
        if (!allows(CronField.SECOND, time.getSecond())
                || !allows(CronField.MINUTE, time.getMinute())
                || !allows(CronField.HOUR, time.getHour())
                || !allows(CronField.MONTH, time.getMonthValue())) {
            return false;
        }
        boolean dom = allows(CronField.DAY_OF_MONTH, time.getDayOfMonth());
        boolean dow = allows(CronField.DAY_OF_WEEK, time.getDayOfWeek().getValue() % 7);
        if (isRestricted(CronField.DAY_OF_MONTH) && isRestricted(CronField.DAY_OF_WEEK)) {
            return dom || dow;
        }
        return dom && dow;
    }

    /**
     * Quartz expression that fires on the day-of-month branch (day-of-week left as '?').
     */
    String quartzDayOfMonthExpression() {
        return String.join(" ",
                list(CronField.SECOND, 0),
                list(CronField.MINUTE, 0),
                list(CronField.HOUR, 0),
                list(CronField.DAY_OF_MONTH, 0),
                list(CronField.MONTH, 0),
                "?");
    }

    /**
     * Quartz expression that fires on the day-of-week branch. Quartz numbers days 1 (SUN) to 7 (SAT).
     */
    String quartzDayOfWeekExpression() {
        return String.join(" ",
                list(CronField.SECOND, 0),
                list(CronField.MINUTE, 0),
                list(CronField.HOUR, 0),
                "?",
                list(CronField.MONTH, 0),
                list(CronField.DAY_OF_WEEK, 1));
    }

    private String list(CronField field, int offset) {
        if (!isRestricted(field)) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        BitSet bits = values.get(field);
        for (int v = bits.nextSetBit(0); v >= 0; v = bits.nextSetBit(v + 1)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v + offset);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
