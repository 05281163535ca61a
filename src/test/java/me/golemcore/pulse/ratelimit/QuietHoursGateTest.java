package me.golemcore.pulse.ratelimit;

import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class QuietHoursGateTest {

    private final QuietHoursGate gate = new QuietHoursGate();

    @Test
    void shouldBeQuietInsideWindowThatCrossesMidnight() {
        HeartbeatRuleSet.QuietHours quiet = window("22:00", "07:00", "UTC");

        assertTrue(gate.isQuiet(quiet, Instant.parse("2026-03-02T23:30:00Z")));
        assertTrue(gate.isQuiet(quiet, Instant.parse("2026-03-03T06:59:00Z")));
        assertTrue(gate.isQuiet(quiet, Instant.parse("2026-03-02T22:00:00Z")));
        assertFalse(gate.isQuiet(quiet, Instant.parse("2026-03-03T07:00:00Z")));
        assertFalse(gate.isQuiet(quiet, Instant.parse("2026-03-03T08:00:00Z")));
    }

    @Test
    void shouldHandleSameDayWindow() {
        HeartbeatRuleSet.QuietHours quiet = window("12:00", "13:00", "UTC");

        assertTrue(gate.isQuiet(quiet, Instant.parse("2026-03-02T12:30:00Z")));
        assertFalse(gate.isQuiet(quiet, Instant.parse("2026-03-02T13:30:00Z")));
    }

    @Test
    void shouldEvaluateInConfiguredTimezone() {
        HeartbeatRuleSet.QuietHours quiet = window("22:00", "07:00", "Europe/Berlin");

        // 21:30 UTC is 22:30 in Berlin in winter
        assertTrue(gate.isQuiet(quiet, Instant.parse("2026-01-15T21:30:00Z")));
        assertFalse(gate.isQuiet(quiet, Instant.parse("2026-01-15T20:30:00Z")));
    }

    @Test
    void shouldNeverBeQuietWhenDisabledOrMalformed() {
        HeartbeatRuleSet.QuietHours disabled = window("00:00", "23:59", "UTC");
        disabled.setEnabled(false);

        assertFalse(gate.isQuiet(disabled, Instant.parse("2026-03-02T12:00:00Z")));
        assertFalse(gate.isQuiet(window("late", "early", "UTC"), Instant.parse("2026-03-02T23:00:00Z")));
        assertFalse(gate.isQuiet(window("10:00", "10:00", "UTC"), Instant.parse("2026-03-02T10:00:00Z")));
        assertFalse(gate.isQuiet(null, Instant.parse("2026-03-02T23:00:00Z")));
    }

    @Test
    void shouldFallBackToUtcForUnknownZone() {
        assertEquals(ZoneOffset.UTC, QuietHoursGate.resolveZone("Mars/Olympus"));
        assertEquals(ZoneOffset.UTC, QuietHoursGate.resolveZone(null));
    }

    private static HeartbeatRuleSet.QuietHours window(String start, String end, String timezone) {
        HeartbeatRuleSet.QuietHours quiet = new HeartbeatRuleSet.QuietHours();
        quiet.setEnabled(true);
        quiet.setStart(start);
        quiet.setEnd(end);
        quiet.setTimezone(timezone);
        return quiet;
    }
}
