package io.pulse4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronScheduleTest {

    @Test
    void fiveFieldCronShouldFireAtNextBoundary() {
        CronSchedule schedule = CronSchedule.parse("*/10 * * * *", ZoneOffset.UTC);
        Instant next = schedule.nextFireAfter(Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void hourlyCronShouldFireAtTopOfNextHour() {
        CronSchedule schedule = CronSchedule.parse("0 * * * *", ZoneOffset.UTC);
        Instant next = schedule.nextFireAfter(Instant.parse("2026-01-01T05:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T06:00:00Z"), next);
    }

    @Test
    void sixFieldCronShouldBeEvaluatedInNamedZone() {
        CronSchedule schedule = CronSchedule.parse("0 0 6 * * *", ZoneId.of("America/New_York"));
        // 2026-01-15T10:00Z is 05:00 in New York (EST, UTC-5)
        Instant next = schedule.nextFireAfter(Instant.parse("2026-01-15T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-15T11:00:00Z"), next);
    }

    @Test
    void dailyAtSyntaxShouldRollOverToTomorrow() {
        CronSchedule schedule = CronSchedule.parse("AT 06:00", "America/New_York");
        Instant next = schedule.nextFireAfter(Instant.parse("2026-01-15T11:00:00Z"));
        assertEquals(Instant.parse("2026-01-16T11:00:00Z"), next);
    }

    @Test
    void normalizeCronShouldPlaceQuestionMarkOnWildcardDayField() {
        assertEquals("0 0 6 ? * MON-FRI", CronSchedule.normalizeCron("0 6 * * MON-FRI"));
        assertEquals("0 30 2 1 * ?", CronSchedule.normalizeCron("30 2 1 * *"));
        assertEquals("0 */5 * * * ?", CronSchedule.normalizeCron("*/5 * * * *"));
    }

    @Test
    void malformedExpressionShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("every now and then", ZoneOffset.UTC));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("AT 25:00", ZoneOffset.UTC));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 * * * *", "Mars/Olympus"));
    }

    @Test
    void fiveFieldDayOfWeekShouldUseUnixNumbering() {
        Instant fridayAfterSix = Instant.parse("2026-03-06T07:00:00Z");

        assertEquals(Instant.parse("2026-03-09T06:00:00Z"),
                CronSchedule.parse("0 6 * * 1-5", ZoneOffset.UTC).nextFireAfter(fridayAfterSix));
        assertEquals(Instant.parse("2026-03-08T06:00:00Z"),
                CronSchedule.parse("0 6 * * 0", ZoneOffset.UTC).nextFireAfter(fridayAfterSix));
        assertEquals(Instant.parse("2026-03-08T06:00:00Z"),
                CronSchedule.parse("0 6 * * 7", ZoneOffset.UTC).nextFireAfter(fridayAfterSix));
    }

    @Test
    void dayOfWeekRenumberingShouldLeaveStepsAndQuartzFormsAlone() {
        assertEquals("0 0 6 ? * 2-6", CronSchedule.normalizeCron("0 6 * * 1-5"));
        assertEquals("0 */15 * ? * 2-6/2", CronSchedule.normalizeCron("*/15 * * * 1-5/2"));
        assertEquals("0 0 6 ? * 2-6", CronSchedule.normalizeCron("0 0 6 ? * 2-6"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 6 * * 8", ZoneOffset.UTC));
    }
}
