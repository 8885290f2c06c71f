package com.example.hostmonitor.store;

import com.example.hostmonitor.domain.MetricSample;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private static MetricSample sample(String metric, double value, long secondsAfterT0) {
        return new MetricSample(metric, value, T0.plusSeconds(secondsAfterT0));
    }

    /** Appends as a live sampler would, with the clock reading the sample's own time. */
    private static boolean appendLive(TimeSeriesStore store, MetricSample sample) {
        return store.append(sample, sample.timestamp());
    }

    @Test
    void queryReturnsInclusiveRangeInTimeOrder() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        for (int i = 0; i < 5; i++) {
            appendLive(store, sample("cpu_percent", i, i * 30L));
        }

        List<MetricSample> result = store.query("cpu_percent", T0.plusSeconds(30), T0.plusSeconds(90));

        assertEquals(3, result.size());
        assertEquals(1.0, result.get(0).value());
        assertEquals(3.0, result.get(2).value());
    }

    @Test
    void queryAcrossMetricsIsSortedByTimestamp() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        appendLive(store, sample("cpu_percent", 1, 0));
        appendLive(store, sample("cpu_percent", 2, 60));
        appendLive(store, sample("memory_percent", 3, 30));

        List<MetricSample> result = store.query(null, null, null);

        assertEquals(List.of(1.0, 3.0, 2.0), result.stream().map(MetricSample::value).toList());
    }

    @Test
    void queryResultIsDetachedFromStore() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        appendLive(store, sample("cpu_percent", 1, 0));

        List<MetricSample> result = store.query("cpu_percent", null, null);
        appendLive(store, sample("cpu_percent", 2, 30));

        assertEquals(1, result.size());
        assertEquals(2, store.size());
    }

    @Test
    void outOfOrderSampleIsDropped() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        assertTrue(appendLive(store, sample("cpu_percent", 1, 60)));
        assertFalse(store.append(sample("cpu_percent", 2, 30), T0.plusSeconds(60)));
        assertTrue(appendLive(store, sample("cpu_percent", 3, 60)));

        assertEquals(2, store.size());
        assertEquals(3.0, store.latest("cpu_percent").orElseThrow().value());
    }

    @Test
    void pruneRemovesSamplesBeforeCutoffAndEmptySeries() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        appendLive(store, sample("cpu_percent", 1, 0));
        appendLive(store, sample("cpu_percent", 2, 100));
        appendLive(store, sample("disk_percent", 3, 10));

        int removed = store.prune(T0.plusSeconds(100));

        assertEquals(2, removed);
        assertEquals(1, store.size());
        assertFalse(store.metricNames().contains("disk_percent"));
    }

    @Test
    void appendPrunesExpiredSamplesPeriodically() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofHours(1), 3);
        appendLive(store, sample("cpu_percent", 1, 0));
        appendLive(store, sample("cpu_percent", 2, 60));
        // third append triggers pruning relative to the caller's clock
        appendLive(store, sample("cpu_percent", 3, 7200));

        assertEquals(1, store.size());
        assertEquals(3.0, store.query("cpu_percent", null, null).get(0).value());
    }

    @Test
    void futureDatedSampleIsRejectedAndLeavesHistoryIntact() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), Duration.ofMinutes(5), 1);
        Instant now = T0;
        for (int i = 0; i < 100; i++) {
            now = T0.plusSeconds(i * 30L);
            store.append(new MetricSample("cpu_percent", i, now), now);
        }

        assertFalse(store.append(new MetricSample("typo", 1, now.plus(Duration.ofDays(365))), now));
        assertTrue(store.append(new MetricSample("typo", 2, now), now));

        assertEquals(100, store.query("cpu_percent", null, null).size());
        assertEquals(2.0, store.latest("typo").orElseThrow().value());
    }

    @Test
    void smallClockSkewIsTolerated() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), Duration.ofMinutes(5), 100);

        assertTrue(store.append(sample("cpu_percent", 1, 240), T0));
        assertFalse(store.append(sample("memory_percent", 1, 301), T0));
    }

    @Test
    void pruneCutoffFollowsCallerClockNotSampleTime() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofHours(1), Duration.ofDays(1), 1);
        store.append(sample("cpu_percent", 1, 0), T0);

        // dated 10 hours ahead but within the skew: history relative to now survives
        store.append(sample("disk_percent", 2, 36_000), T0.plusSeconds(60));

        assertEquals(1, store.query("cpu_percent", null, null).size());
    }

    @Test
    void latestAllReportsNewestPerMetric() {
        TimeSeriesStore store = new TimeSeriesStore(Duration.ofDays(30), 100);
        appendLive(store, sample("cpu_percent", 10, 0));
        appendLive(store, sample("cpu_percent", 20, 30));
        appendLive(store, sample("memory_percent", 50, 0));

        assertEquals(20.0, store.latestAll().get("cpu_percent").value());
        assertEquals(50.0, store.latestAll().get("memory_percent").value());
        assertTrue(store.latest("load_avg_1min").isEmpty());
    }
}
