package com.example.hostmonitor.analytics;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.AnomalyRecord;
import com.example.hostmonitor.domain.Baseline;
import com.example.hostmonitor.domain.MetricSample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Anomaly Detector - compares each new sample with its metric's baseline band.
 * <p>
 * Cold-start metrics (no baseline yet) never produce anomalies. Detected
 * anomalies go into a read-only feed kept for a shorter window than raw
 * samples; they do not open incidents.
 */
@Slf4j
@Component
public class AnomalyDetector {

    /** Keeps the ratio finite when stddev is zero */
    static final double STDDEV_EPSILON = 1e-6;

    private final BaselineEstimator baselineEstimator;
    private final MeterRegistry meterRegistry;
    private final Duration retention;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ArrayDeque<AnomalyRecord> feed = new ArrayDeque<>();

    public AnomalyDetector(BaselineEstimator baselineEstimator, MeterRegistry meterRegistry,
                           MonitorProperties properties) {
        this.baselineEstimator = baselineEstimator;
        this.meterRegistry = meterRegistry;
        this.retention = Duration.ofDays(properties.getRetention().getAnomalyDays());
    }

    /**
     * Check one sample; an anomaly, if any, is appended to the feed and returned.
     */
    public Optional<AnomalyRecord> detect(MetricSample sample) {
        Optional<Baseline> baseline = baselineEstimator.find(sample.metricName());
        if (baseline.isEmpty()) {
            return Optional.empty();
        }

        Optional<AnomalyRecord> anomaly = evaluate(sample, baseline.get());
        anomaly.ifPresent(record -> {
            lock.writeLock().lock();
            try {
                feed.addLast(record);
            } finally {
                lock.writeLock().unlock();
            }
            Counter.builder("hostmonitor.anomalies.detected")
                    .tag("metric", record.metricName())
                    .tag("severity", record.severity().name())
                    .register(meterRegistry)
                    .increment();
            log.warn("Anomaly detected: {}", record.description());
        });
        return anomaly;
    }

    static Optional<AnomalyRecord> evaluate(MetricSample sample, Baseline baseline) {
        double value = sample.value();
        if (value <= baseline.upperThreshold() && value >= baseline.lowerThreshold()) {
            return Optional.empty();
        }

        // severity buckets the raw ratio, the stored score is clamped to [0, 1]
        double ratio = Math.abs(value - baseline.mean()) / (baseline.stddev() + STDDEV_EPSILON);
        String direction = value > baseline.mean() ? "above" : "below";
        String description = String.format("%s is %s baseline: %.2f (baseline mean %.2f)",
                sample.metricName(), direction, value, baseline.mean());

        return Optional.of(new AnomalyRecord(
                sample.timestamp(),
                sample.metricName(),
                value,
                baseline.mean(),
                Math.min(ratio, 1.0),
                AnomalyRecord.Severity.fromRatio(ratio),
                description));
    }

    /**
     * Anomalies at or after {@code since}, oldest first.
     */
    public List<AnomalyRecord> recent(Instant since) {
        lock.readLock().lock();
        try {
            List<AnomalyRecord> result = new ArrayList<>();
            for (AnomalyRecord record : feed) {
                if (!record.timestamp().isBefore(since)) {
                    result.add(record);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop anomalies older than the anomaly retention window.
     */
    public int prune(Instant now) {
        Instant cutoff = now.minus(retention);
        lock.writeLock().lock();
        try {
            int removed = 0;
            while (!feed.isEmpty() && feed.peekFirst().timestamp().isBefore(cutoff)) {
                feed.pollFirst();
                removed++;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
