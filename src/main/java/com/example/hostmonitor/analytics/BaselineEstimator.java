package com.example.hostmonitor.analytics;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.Baseline;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maintains one {@link Baseline} per tracked metric from the trailing window of samples.
 * <p>
 * The refresh check runs once per collection cycle. A metric is recomputed
 * only when it has no baseline yet or its baseline is older than the refresh
 * interval; other metrics are left alone. A metric whose last attempt found
 * too few samples keeps its previous baseline and is not retried until a newer
 * sample arrives. The window covers samples strictly before the refresh time,
 * so a baseline never contains the reading it is checked against.
 */
@Slf4j
@Component
public class BaselineEstimator {

    private final TimeSeriesStore store;
    private final Duration window;
    private final Duration refreshInterval;
    private final int minSamples;

    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();
    /** Newest sample timestamp seen by the last unsuccessful attempt, per metric */
    private final Map<String, Instant> failedAttempts = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public BaselineEstimator(TimeSeriesStore store, MonitorProperties properties) {
        this.store = store;
        this.window = Duration.ofDays(properties.getBaseline().getWindowDays());
        this.refreshInterval = Duration.ofHours(properties.getBaseline().getRefreshIntervalHours());
        this.minSamples = properties.getBaseline().getMinSamples();
    }

    public boolean isRefreshDue(Instant now) {
        return !dueMetrics(now).isEmpty();
    }

    /**
     * Metrics whose baseline is missing or stale and that have new samples since the last failed attempt.
     */
    Set<String> dueMetrics(Instant now) {
        Set<String> due = new LinkedHashSet<>();
        for (String metric : store.metricNames()) {
            Baseline baseline = baselines.get(metric);
            boolean needed = baseline == null
                    || Duration.between(baseline.lastUpdated(), now).compareTo(refreshInterval) >= 0;
            if (needed && hasNewSamples(metric)) {
                due.add(metric);
            }
        }
        return due;
    }

    private boolean hasNewSamples(String metric) {
        Instant attempted = failedAttempts.get(metric);
        if (attempted == null) return true;
        return store.latest(metric).map(s -> s.timestamp().isAfter(attempted)).orElse(false);
    }

    /**
     * @return number of baselines replaced
     */
    public int refreshIfDue(Instant now) {
        Set<String> due = dueMetrics(now);
        return due.isEmpty() ? 0 : recompute(due, now);
    }

    /**
     * Recompute every tracked metric.
     */
    public int recompute(Instant now) {
        return recompute(store.metricNames(), now);
    }

    /**
     * Recompute the given metrics. A failure on one metric is logged and does not stop the others.
     */
    int recompute(Collection<String> metrics, Instant now) {
        int updated = 0;
        for (String metric : metrics) {
            try {
                Optional<Baseline> baseline = compute(metric, now);
                if (baseline.isPresent()) {
                    baselines.put(metric, baseline.get());
                    failedAttempts.remove(metric);
                    updated++;
                    log.info("Updated baseline {}: mean={}, stddev={}, samples={}",
                            metric, String.format("%.2f", baseline.get().mean()),
                            String.format("%.2f", baseline.get().stddev()), baseline.get().sampleCount());
                } else {
                    store.latest(metric).ifPresent(s -> failedAttempts.put(metric, s.timestamp()));
                }
            } catch (RuntimeException e) {
                log.error("Baseline computation failed for {}: {}", metric, e.getMessage(), e);
            }
        }
        if (updated > 0) {
            version.incrementAndGet();
        }
        return updated;
    }

    Optional<Baseline> compute(String metric, Instant now) {
        List<Double> values = store.query(metric, now.minus(window), now).stream()
                .filter(s -> s.timestamp().isBefore(now))
                .map(MetricSample::value)
                .toList();
        if (values.size() < minSamples) {
            log.debug("Not enough samples for {} baseline ({} < {}), keeping previous", metric, values.size(), minSamples);
            return Optional.empty();
        }
        return Optional.of(Baseline.of(metric, Stats.mean(values), Stats.stddev(values), values.size(), now));
    }

    public Optional<Baseline> find(String metric) {
        return Optional.ofNullable(baselines.get(metric));
    }

    public Map<String, Baseline> all() {
        return new LinkedHashMap<>(baselines);
    }

    /**
     * Load previously persisted baselines, replacing the current ones.
     */
    public void restore(Collection<Baseline> restored) {
        baselines.clear();
        failedAttempts.clear();
        for (Baseline baseline : restored) {
            baselines.put(baseline.metricName(), baseline);
        }
        log.info("Restored {} baselines", baselines.size());
    }

    /** Incremented whenever the baseline set changes; used to skip redundant snapshots. */
    public long version() {
        return version.get();
    }
}
