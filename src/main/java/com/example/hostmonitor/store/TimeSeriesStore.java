package com.example.hostmonitor.store;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, append-only retention of metric samples.
 * <p>
 * One deque per metric name, in insertion (= time) order. The sampling loop is
 * the only writer; API handlers read concurrently through {@link #query} which
 * always returns a detached copy. Expired samples are pruned once every
 * {@code pruneEveryAppends} appends rather than on every call, relative to
 * the caller's clock. Sample timestamps never move the retention cutoff, and a
 * sample dated more than {@code maxFutureSkew} after that clock is rejected.
 */
@Slf4j
@Component
public class TimeSeriesStore {

    private final Duration retention;
    private final Duration maxFutureSkew;
    private final int pruneEveryAppends;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ArrayDeque<MetricSample>> series = new LinkedHashMap<>();
    private int appendsSincePrune;

    @Autowired
    public TimeSeriesStore(MonitorProperties properties) {
        this(Duration.ofDays(properties.getRetention().getSampleDays()),
                Duration.ofSeconds(properties.getSampling().getMaxFutureSkewSeconds()),
                properties.getRetention().getPruneEveryAppends());
    }

    public TimeSeriesStore(Duration retention, int pruneEveryAppends) {
        this(retention, Duration.ofMinutes(5), pruneEveryAppends);
    }

    public TimeSeriesStore(Duration retention, Duration maxFutureSkew, int pruneEveryAppends) {
        this.retention = retention;
        this.maxFutureSkew = maxFutureSkew;
        this.pruneEveryAppends = Math.max(1, pruneEveryAppends);
    }

    // ── Mutation ──

    /**
     * Append a sample to its metric's series.
     *
     * @param now current time of the caller; drives the retention cutoff
     * @return false if the sample is dated too far after {@code now}, or is older
     *         than the newest one already stored for that metric; such samples are
     *         dropped so the series never reorders
     */
    public boolean append(MetricSample sample, Instant now) {
        if (sample.timestamp().isAfter(now.plus(maxFutureSkew))) {
            log.warn("Dropping future-dated sample for {}: {} is after {}",
                    sample.metricName(), sample.timestamp(), now);
            return false;
        }
        lock.writeLock().lock();
        try {
            ArrayDeque<MetricSample> deque = series.computeIfAbsent(sample.metricName(), k -> new ArrayDeque<>());
            MetricSample last = deque.peekLast();
            if (last != null && sample.timestamp().isBefore(last.timestamp())) {
                log.warn("Dropping out-of-order sample for {}: {} is before {}",
                        sample.metricName(), sample.timestamp(), last.timestamp());
                return false;
            }
            deque.addLast(sample);

            if (++appendsSincePrune >= pruneEveryAppends) {
                appendsSincePrune = 0;
                pruneLocked(now.minus(retention));
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every sample with a timestamp strictly before {@code cutoff}.
     *
     * @return number of samples removed
     */
    public int prune(Instant cutoff) {
        lock.writeLock().lock();
        try {
            return pruneLocked(cutoff);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int pruneLocked(Instant cutoff) {
        int removed = 0;
        Iterator<Map.Entry<String, ArrayDeque<MetricSample>>> it = series.entrySet().iterator();
        while (it.hasNext()) {
            ArrayDeque<MetricSample> deque = it.next().getValue();
            while (!deque.isEmpty() && deque.peekFirst().timestamp().isBefore(cutoff)) {
                deque.pollFirst();
                removed++;
            }
            if (deque.isEmpty()) {
                it.remove();
            }
        }
        if (removed > 0) {
            log.info("Pruned {} samples older than {}", removed, cutoff);
        }
        return removed;
    }

    // ── Query ──

    /**
     * Samples with {@code since <= timestamp <= until}, oldest first.
     *
     * @param metric metric name, or null for every metric
     * @param since  inclusive lower bound, or null for unbounded
     * @param until  inclusive upper bound, or null for unbounded
     */
    public List<MetricSample> query(String metric, Instant since, Instant until) {
        lock.readLock().lock();
        try {
            List<MetricSample> result = new ArrayList<>();
            if (metric != null) {
                ArrayDeque<MetricSample> deque = series.get(metric);
                if (deque != null) {
                    collect(deque, since, until, result);
                }
                return result;
            }
            for (ArrayDeque<MetricSample> deque : series.values()) {
                collect(deque, since, until, result);
            }
            // stable sort keeps per-metric insertion order for equal timestamps
            result.sort(Comparator.comparing(MetricSample::timestamp));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void collect(ArrayDeque<MetricSample> deque, Instant since, Instant until,
                                List<MetricSample> out) {
        for (MetricSample sample : deque) {
            if (since != null && sample.timestamp().isBefore(since)) continue;
            if (until != null && sample.timestamp().isAfter(until)) break;
            out.add(sample);
        }
    }

    public Optional<MetricSample> latest(String metric) {
        lock.readLock().lock();
        try {
            ArrayDeque<MetricSample> deque = series.get(metric);
            return deque == null ? Optional.empty() : Optional.ofNullable(deque.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Latest value of every tracked metric.
     */
    public Map<String, MetricSample> latestAll() {
        lock.readLock().lock();
        try {
            Map<String, MetricSample> latest = new LinkedHashMap<>();
            series.forEach((name, deque) -> {
                if (!deque.isEmpty()) latest.put(name, deque.peekLast());
            });
            return latest;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> metricNames() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(series.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return series.values().stream().mapToInt(ArrayDeque::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getRetention() {
        return retention;
    }

    public Duration getMaxFutureSkew() {
        return maxFutureSkew;
    }
}
