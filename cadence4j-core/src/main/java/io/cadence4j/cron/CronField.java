package io.cadence4j.cron;

import java.util.List;
import java.util.Locale;

/**
 * The six positions of a cron expression, seconds first.
 */
public enum CronField {
    SECOND("second", 0, 59, List.of()),
    MINUTE("minute", 0, 59, List.of()),
    HOUR("hour", 0, 23, List.of()),
    DAY_OF_MONTH("day-of-month", 1, 31, List.of()),
    MONTH("month", 1, 12,
            List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
    // 7 is accepted as an alias of 0 (Sunday)
    DAY_OF_WEEK("day-of-week", 0, 7,
            List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

    private final String label;
    private final int min;
    private final int max;
    private final List<String> names;

    CronField(String label, int min, int max, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.names = names;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    /**
     * Resolves a symbolic value (JAN, mon, ...) to its number, or -1 if the field has no such name.
     */
    int valueOfName(String name) {
        int idx = names.indexOf(name.toUpperCase(Locale.ROOT));
        if (idx < 0) {
            return -1;
        }
        return this == MONTH ? idx + 1 : idx;
    }
}
