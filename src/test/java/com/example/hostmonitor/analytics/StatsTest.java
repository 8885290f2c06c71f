package com.example.hostmonitor.analytics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatsTest {

    @Test
    void sampleStandardDeviationUsesNMinusOne() {
        // mean 5, squared deviations sum to 32
        double stddev = Stats.stddev(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));
        assertEquals(Math.sqrt(32.0 / 7), stddev, 1e-9);
    }

    @Test
    void singleValueHasZeroDeviation() {
        assertEquals(0.0, Stats.stddev(List.of(42.0)));
        assertEquals(42.0, Stats.mean(List.of(42.0)));
    }

    @Test
    void predictNextExtrapolatesLinearSeries() {
        assertEquals(50.0, Stats.predictNext(List.of(10.0, 20.0, 30.0, 40.0)), 1e-9);
    }

    @Test
    void predictNextOfFlatSeriesIsTheValue() {
        assertEquals(7.0, Stats.predictNext(List.of(7.0, 7.0, 7.0)), 1e-9);
    }
}
