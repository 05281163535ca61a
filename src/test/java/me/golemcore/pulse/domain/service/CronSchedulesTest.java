package me.golemcore.pulse.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronSchedulesTest {

    @Test
    void shouldPrependSecondsToFiveFieldExpressions() {
        assertEquals("0 0 9 * * MON-FRI", CronSchedules.normalize("0 9 * * MON-FRI"));
        assertEquals("30 0 9 * * *", CronSchedules.normalize("  30 0 9 * * *  "));
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.normalize(""));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.normalize("* * *"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.normalize("0 99 * * *"));
    }

    @Test
    void shouldEvaluateInTenantZone() {
        Instant after = Instant.parse("2026-03-02T06:00:00Z");

        assertEquals(Instant.parse("2026-03-02T08:00:00Z"),
                CronSchedules.next("0 9 * * *", after, ZoneId.of("Europe/Berlin")));
        assertEquals(Instant.parse("2026-03-02T09:00:00Z"), CronSchedules.next("0 9 * * *", after, ZoneOffset.UTC));
    }

    @Test
    void shouldBeDueOnlyWhenOccurrenceFallsInWindow() {
        Instant since = Instant.parse("2026-03-02T08:59:00Z");

        assertFalse(CronSchedules.isDue("0 9 * * *", since, Instant.parse("2026-03-02T08:59:59Z"), ZoneOffset.UTC));
        assertTrue(CronSchedules.isDue("0 9 * * *", since, Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC));
        assertFalse(CronSchedules.isDue("0 9 * * *", Instant.parse("2026-03-02T09:00:00Z"),
                Instant.parse("2026-03-02T12:00:00Z"), ZoneOffset.UTC));
    }
}
