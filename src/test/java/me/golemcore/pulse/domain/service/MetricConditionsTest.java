package me.golemcore.pulse.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricConditionsTest {

    @Test
    void shouldCompareAgainstThreshold() {
        assertTrue(MetricConditions.matches("gt", 6.0, null, 5.0, false));
        assertFalse(MetricConditions.matches("gt", 5.0, null, 5.0, false));
        assertTrue(MetricConditions.matches("GTE", 5.0, null, 5.0, false));
        assertTrue(MetricConditions.matches("eq", 0.1 + 0.2, null, 0.3, false));
        assertTrue(MetricConditions.matches("neq", 1.0, null, 2.0, false));
    }

    @Test
    void shouldMeasureChangeInPercentOrAbsolute() {
        assertTrue(MetricConditions.matches("decreases_by", 8000.0, 10000.0, 20.0, true));
        assertFalse(MetricConditions.matches("decreases_by", 8100.0, 10000.0, 20.0, true));
        assertTrue(MetricConditions.matches("increases_by", 15.0, 10.0, 5.0, false));
        assertTrue(MetricConditions.matches("changes_by", 7.0, 10.0, 3.0, false));
    }

    @Test
    void shouldNotMatchWithoutRequiredValues() {
        assertFalse(MetricConditions.matches("gt", null, null, 1.0, false));
        assertFalse(MetricConditions.matches("increases_by", 10.0, null, 1.0, false));
        assertFalse(MetricConditions.matches("above", 10.0, 1.0, 1.0, false));
        assertFalse(MetricConditions.isKnownOperator("drops_by"));
    }

    @Test
    void shouldFallBackToAbsoluteChangeWhenPreviousIsZero() {
        assertEquals(5.0, MetricConditions.change(5.0, 0.0, true));
    }
}
