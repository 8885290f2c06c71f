package com.example.hostmonitor.analytics;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.Baseline;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.store.TimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BaselineEstimatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private TimeSeriesStore store;
    private BaselineEstimator estimator;

    @BeforeEach
    void setUp() {
        store = new TimeSeriesStore(Duration.ofDays(30), 1000);
        estimator = new BaselineEstimator(store, new MonitorProperties());
    }

    /** Appends one sample per hour and returns the hour after the last one. */
    private Instant fillHourly(String metric, int count, double... pattern) {
        for (int i = 0; i < count; i++) {
            Instant ts = T0.plus(Duration.ofHours(i));
            store.append(new MetricSample(metric, pattern[i % pattern.length], ts), ts);
        }
        return T0.plus(Duration.ofHours(count));
    }

    @Test
    void noBaselineBelowMinimumSampleCount() {
        Instant now = fillHourly("cpu_percent", 23, 50.0);

        assertEquals(0, estimator.recompute(now));
        assertTrue(estimator.find("cpu_percent").isEmpty());
    }

    @Test
    void baselineBandIsTwoSigmasAroundMean() {
        Instant now = fillHourly("cpu_percent", 24, 40.0, 60.0);

        assertEquals(1, estimator.recompute(now));
        Baseline baseline = estimator.find("cpu_percent").orElseThrow();

        double expectedStddev = Stats.stddev(List.of(
                40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0,
                40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0, 40.0, 60.0));
        assertEquals(50.0, baseline.mean(), 1e-9);
        assertEquals(expectedStddev, baseline.stddev(), 1e-9);
        assertEquals(50.0 + 2 * expectedStddev, baseline.upperThreshold(), 1e-9);
        assertEquals(50.0 - 2 * expectedStddev, baseline.lowerThreshold(), 1e-9);
        assertEquals(24, baseline.sampleCount());
        assertEquals(0.95, baseline.confidenceLevel());
        assertEquals(now, baseline.lastUpdated());
    }

    @Test
    void lowerThresholdIsFlooredAtZero() {
        Instant now = fillHourly("disk_io", 24, 0.0, 10.0, 0.0, 0.0);

        estimator.recompute(now);
        Baseline baseline = estimator.find("disk_io").orElseThrow();

        assertTrue(baseline.mean() - 2 * baseline.stddev() < 0);
        assertEquals(0.0, baseline.lowerThreshold());
        assertTrue(baseline.upperThreshold() >= baseline.mean());
    }

    @Test
    void refreshIsDueForUntrackedMetricOrStaleBaseline() {
        Instant now = fillHourly("cpu_percent", 24, 50.0);
        assertTrue(estimator.isRefreshDue(now));

        estimator.refreshIfDue(now);
        assertFalse(estimator.isRefreshDue(now.plus(Duration.ofHours(23))));
        assertTrue(estimator.isRefreshDue(now.plus(Duration.ofHours(24))));
    }

    @Test
    void staleBaselineIsKeptWhenWindowRunsDry() {
        Instant now = fillHourly("cpu_percent", 24, 50.0);
        estimator.recompute(now);
        long version = estimator.version();

        // eight days later nothing is left in the seven day window
        assertEquals(0, estimator.recompute(now.plus(Duration.ofDays(8))));
        assertEquals(50.0, estimator.find("cpu_percent").orElseThrow().mean(), 1e-9);
        assertEquals(version, estimator.version());
    }

    @Test
    void sampleAtRefreshTimeIsNotPartOfItsOwnBaseline() {
        Instant now = fillHourly("cpu_percent", 24, 50.0);
        store.append(new MetricSample("cpu_percent", 95.0, now), now);

        estimator.recompute(now);
        Baseline baseline = estimator.find("cpu_percent").orElseThrow();

        assertEquals(50.0, baseline.mean(), 1e-9);
        assertEquals(24, baseline.sampleCount());
    }

    @Test
    void coldMetricDoesNotForceRefreshOfOthers() {
        Instant now = fillHourly("cpu_percent", 24, 40.0, 60.0);
        assertEquals(1, estimator.refreshIfDue(now));
        long version = estimator.version();

        store.append(new MetricSample("rare_metric", 1.0, now), now);
        for (int tick = 1; tick <= 5; tick++) {
            Instant later = now.plusSeconds(30L * tick);
            store.append(new MetricSample("cpu_percent", 50.0, later), later);
            assertEquals(0, estimator.refreshIfDue(later));
        }

        assertEquals(now, estimator.find("cpu_percent").orElseThrow().lastUpdated());
        assertEquals(version, estimator.version());
        assertFalse(estimator.isRefreshDue(now.plusSeconds(180)));
    }

    @Test
    void coldMetricIsRetriedOnceNewSamplesArrive() {
        Instant now = fillHourly("rare_metric", 24, 5.0);
        store.append(new MetricSample("late_metric", 1.0, now), now);
        estimator.refreshIfDue(now.plusSeconds(30));
        assertFalse(estimator.dueMetrics(now.plusSeconds(60)).contains("late_metric"));

        Instant next = now.plusSeconds(90);
        store.append(new MetricSample("late_metric", 2.0, next), next);

        assertEquals(Set.of("late_metric"), estimator.dueMetrics(next));
    }
}
