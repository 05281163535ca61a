package me.golemcore.pulse.adapter.outbound.metrics;

import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoredMetricsAdapterTest {

    private MutableClock clock;
    private StoredMetricsAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T12:00:00Z"));
        adapter = new StoredMetricsAdapter(PulseTestSupport.tableStore(), clock);
    }

    @Test
    void shouldReturnEmptyMapsWithoutHistory() {
        assertTrue(adapter.latest("acme").isEmpty());
        assertTrue(adapter.previous("acme").isEmpty());
    }

    @Test
    void shouldExposeLatestAndPreviousSnapshots() {
        adapter.record("acme", Map.of("mrr", 10000.0));
        clock.advance(Duration.ofHours(1));
        adapter.record("acme", Map.of("mrr", 9000.0));
        adapter.record("globex", Map.of("mrr", 1.0));

        assertEquals(Map.of("mrr", 9000.0), adapter.latest("acme"));
        assertEquals(Map.of("mrr", 10000.0), adapter.previous("acme"));
    }

    @Test
    void shouldKeepOnlyRecentSnapshots() {
        for (int i = 0; i <= StoredMetricsAdapter.MAX_SNAPSHOTS; i++) {
            adapter.record("acme", Map.of("signups", (double) i));
            clock.advance(Duration.ofMinutes(1));
        }

        assertEquals(Map.of("signups", (double) StoredMetricsAdapter.MAX_SNAPSHOTS), adapter.latest("acme"));
        assertEquals(Map.of("signups", 99.0), adapter.previous("acme"));
    }
}
