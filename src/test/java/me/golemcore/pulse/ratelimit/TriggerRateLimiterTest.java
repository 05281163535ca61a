package me.golemcore.pulse.ratelimit;

import me.golemcore.pulse.domain.model.RateLimitResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerRateLimiterTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

    private final TriggerRateLimiter limiter = new TriggerRateLimiter();

    @Test
    void shouldSuppressInsideCooldown() {
        Instant last = NOW.minus(Duration.ofMinutes(20));

        RateLimitResult result = limiter.check(60, 0, last, List.of(last), ZoneOffset.UTC, NOW);

        assertFalse(result.isAllowed());
        assertTrue(result.getReason().startsWith("cooldown active"));
        assertEquals(Duration.ofMinutes(40), result.getRetryAfter());
        assertEquals("cooldown active (60 min), retry in 40m", result.skipSummary());
    }

    @Test
    void shouldAllowWhenCooldownElapsed() {
        Instant last = NOW.minus(Duration.ofMinutes(60));

        assertTrue(limiter.check(60, 0, last, List.of(last), ZoneOffset.UTC, NOW).isAllowed());
    }

    @Test
    void shouldEnforceDailyCapOnSameLocalDay() {
        List<Instant> fired = List.of(
                Instant.parse("2026-03-02T01:00:00Z"),
                Instant.parse("2026-03-02T09:00:00Z"),
                Instant.parse("2026-03-01T23:00:00Z"));

        RateLimitResult result = limiter.check(0, 2, fired.get(1), fired, ZoneOffset.UTC, NOW);

        assertFalse(result.isAllowed());
        assertEquals("daily cap reached (2 per day)", result.getReason());
        assertEquals("daily cap reached (2 per day), retry in 9h", result.skipSummary());
    }

    @Test
    void shouldCountDayInGivenZone() {
        // 23:00 UTC on Mar 1 is already Mar 2 in Berlin
        List<Instant> fired = List.of(Instant.parse("2026-03-01T23:00:00Z"));

        assertTrue(limiter.check(0, 1, null, fired, ZoneOffset.UTC, NOW).isAllowed());
        assertFalse(limiter.check(0, 1, null, fired, ZoneId.of("Europe/Berlin"), NOW).isAllowed());
    }

    @Test
    void shouldAllowEverythingWithoutLimits() {
        RateLimitResult result = limiter.check(0, 0, NOW, List.of(NOW, NOW, NOW), ZoneOffset.UTC, NOW);

        assertTrue(result.isAllowed());
        assertEquals(Long.MAX_VALUE, result.getRemaining());
    }
}
