package com.platform.prioritizer.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdTest {

    @Test
    void testPercentileCountIsFloored() {
        assertEquals(10, Threshold.percentile(10.0).count(100));
        assertEquals(4, Threshold.percentile(5.0).count(99));
        assertEquals(0, Threshold.percentile(1.0).count(50));
    }

    @Test
    void testTopNIsCappedAtRowCount() {
        assertEquals(10, Threshold.topN(10).count(100));
        assertEquals(5, Threshold.topN(10).count(5));
    }

    @Test
    void testAllSelectedIsUnspecified() {
        assertFalse(Threshold.ALL_SELECTED.specified());
        assertEquals(7, Threshold.ALL_SELECTED.count(7));
    }

    @Test
    void testParameterStrings() {
        assertEquals("10_abs", Threshold.topN(10).parameter());
        assertEquals("5.0_pct", Threshold.percentile(5.0).parameter());
        assertEquals("99.9_pct", Threshold.percentile(99.9).parameter());
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> Threshold.percentile(100.5));
        assertThrows(IllegalArgumentException.class, () -> Threshold.percentile(-1));
        assertThrows(IllegalArgumentException.class, () -> new Threshold(Threshold.Unit.TOP_N, 2.5, true));
    }
}
