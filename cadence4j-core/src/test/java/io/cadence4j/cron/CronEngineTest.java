package io.cadence4j.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronEngineTest {

    private final CronEngine engine = new CronEngine(ZoneOffset.UTC);

    @Test
    void nextShouldSupportFiveFieldCron() {
        Instant next = engine.next("*/5 * * * *", Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextShouldSupportSixFieldCronWithSeconds() {
        Instant next = engine.next("*/10 * * * * *", Instant.parse("2026-01-01T00:00:05Z"));
        assertEquals(Instant.parse("2026-01-01T00:00:10Z"), next);
    }

    @Test
    void nextShouldBeStrictlyAfterReference() {
        Instant reference = Instant.parse("2026-01-01T01:00:00Z");
        assertEquals(Instant.parse("2026-01-01T02:00:00Z"), engine.next("0 * * * *", reference));
    }

    @Test
    void dayOfMonthAndDayOfWeekShouldBeOredWhenBothRestricted() {
        // the 13th of the month or any Friday; 2026-01-01 is a Thursday
        CronSchedule schedule = engine.parse("0 9 13 * 5");

        assertEquals(Instant.parse("2026-01-02T09:00:00Z"), engine.next(schedule, Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(Instant.parse("2026-01-09T09:00:00Z"), engine.next(schedule, Instant.parse("2026-01-02T10:00:00Z")));
        assertEquals(Instant.parse("2026-01-13T09:00:00Z"), engine.next(schedule, Instant.parse("2026-01-09T10:00:00Z")));
    }

    @Test
    void dayOfWeekRangeAndNamesShouldWork() {
        // Saturday -> Monday
        Instant next = engine.next("0 9 * * MON-FRI", Instant.parse("2026-01-03T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);
    }

    @Test
    void sevenShouldMeanSunday() {
        assertEquals(engine.parse("0 0 * * 0"), engine.parse("0 0 * * 7"));
        assertEquals(Instant.parse("2026-01-04T00:00:00Z"), engine.next("0 0 * * 7", Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void monthNamesAndListsShouldWork() {
        Instant next = engine.next("0 0 1 jan,JUL *", Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-07-01T00:00:00Z"), next);
    }

    @Test
    void stepFromStartValueShouldRunToFieldMax() {
        Instant next = engine.next("5/15 * * * *", Instant.parse("2026-01-01T00:06:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:20:00Z"), next);
    }

    @Test
    void leapDayShouldBeReachable() {
        Instant next = engine.next("0 0 29 2 *", Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2028-02-29T00:00:00Z"), next);
    }

    @Test
    void macrosShouldExpand() {
        assertEquals(Instant.parse("2026-01-01T01:00:00Z"), engine.next("@hourly", Instant.parse("2026-01-01T00:30:00Z")));
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), engine.next("@daily", Instant.parse("2026-01-01T00:30:00Z")));
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), engine.next("@monthly", Instant.parse("2026-01-01T00:30:00Z")));
    }

    @Test
    void namesAndMacrosShouldParseRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Instant reference = Instant.parse("2026-01-01T00:00:00Z");
            assertEquals(Instant.parse("2026-01-02T09:00:00Z"), engine.next("0 9 * * fri", reference));
            assertEquals(Instant.parse("2026-01-02T00:00:00Z"), engine.next("@DAILY", reference));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void nextShouldRespectEngineZone() {
        CronEngine tokyo = new CronEngine(ZoneId.of("Asia/Tokyo"));
        // 00:00Z is 09:00 in Tokyo, so the next 09:00 Tokyo is a day later
        Instant next = tokyo.next("0 9 * * *", Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), next);
    }

    @Test
    void malformedExpressionsShouldFailWithDescriptiveError() {
        List<String> invalid = List.of(
                "* * * *",
                "* * * * * * *",
                "60 * * * *",
                "* 24 * * *",
                "*/0 * * * *",
                "5-1 * * * *",
                "* * * FOO *",
                "1,,2 * * * *",
                "L * * * *",
                "? * * * *",
                "0 0 30 2 *",
                "0 0 31 2,4 *",
                "@fortnightly"
        );
        for (String expression : invalid) {
            ScheduleParseException ex = assertThrows(ScheduleParseException.class, () -> engine.parse(expression),
                    "expected rejection of " + expression);
            assertEquals(expression, ex.getExpression());
            assertTrue(ex.getMessage().contains(expression));
        }
        assertThrows(ScheduleParseException.class, () -> engine.parse(" "));
        assertThrows(ScheduleParseException.class, () -> engine.parse(null));
    }

    @Test
    void isValidShouldRecognizeWellFormedExpressions() {
        assertTrue(engine.isValid("0 */10 * * * *"));
        assertFalse(engine.isValid("every five minutes"));
    }

    @Test
    void nextShouldBeEarliestMatchingInstant() {
        List<String> expressions = List.of(
                "*/7 * * * *",
                "15 3 * * *",
                "0 0 13 * 5",
                "0 12 * * MON-FRI",
                "30 */2 1-7 * *"
        );
        List<Instant> references = List.of(
                Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-02-27T23:59:30Z"),
                Instant.parse("2026-03-29T01:30:00Z"),
                Instant.parse("2026-12-31T23:58:00Z")
        );

        for (String expression : expressions) {
            CronSchedule schedule = engine.parse(expression);
            for (Instant reference : references) {
                Instant next = engine.next(schedule, reference);
                assertTrue(next.isAfter(reference), expression + " from " + reference);
                assertTrue(schedule.matches(ZonedDateTime.ofInstant(next, ZoneOffset.UTC)), expression + " -> " + next);

                Instant candidate = reference.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
                while (candidate.isBefore(next)) {
                    assertFalse(schedule.matches(ZonedDateTime.ofInstant(candidate, ZoneOffset.UTC)),
                            expression + " skipped " + candidate + " before " + next);
                    candidate = candidate.plus(1, ChronoUnit.MINUTES);
                }
            }
        }
    }
}
