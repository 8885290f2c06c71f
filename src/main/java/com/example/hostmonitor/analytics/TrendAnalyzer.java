package com.example.hostmonitor.analytics;

import com.example.hostmonitor.domain.CapacityForecast;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.domain.TrendAnalysis;
import com.example.hostmonitor.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Trend and capacity derivatives computed on demand from the time series store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendAnalyzer {

    /** Half-to-half change below this percentage counts as stable */
    static final double STABLE_BAND_PERCENT = 5.0;
    static final int PREDICTION_POINTS = 5;

    static final double CAPACITY_CEILING_PERCENT = 95.0;
    static final int FORECAST_MIN_SAMPLES = 7;
    static final Duration FORECAST_HISTORY = Duration.ofDays(30);

    private final TimeSeriesStore store;

    /**
     * Trend per metric over the trailing {@code window}; metrics with fewer than two samples are skipped.
     */
    public List<TrendAnalysis> trends(Duration window, Instant now) {
        List<TrendAnalysis> trends = new ArrayList<>();
        for (String metric : store.metricNames()) {
            List<Double> values = values(metric, now.minus(window), now);
            if (values.size() < 2) continue;
            trends.add(analyze(metric, values));
        }
        return trends;
    }

    static TrendAnalysis analyze(String metric, List<Double> values) {
        double average = Stats.mean(values);
        double min = Collections.min(values);
        double max = Collections.max(values);
        double stddev = Stats.stddev(values);

        int half = values.size() / 2;
        double firstAvg = Stats.mean(values.subList(0, half));
        double secondAvg = Stats.mean(values.subList(half, values.size()));
        double changePercent = firstAvg != 0 ? (secondAvg - firstAvg) / firstAvg * 100 : 0.0;

        TrendAnalysis.Direction direction;
        if (Math.abs(changePercent) < STABLE_BAND_PERCENT) {
            direction = TrendAnalysis.Direction.STABLE;
        } else if (changePercent > 0) {
            direction = TrendAnalysis.Direction.RISING;
        } else {
            direction = TrendAnalysis.Direction.FALLING;
        }

        double predicted = values.size() >= 3
                ? Stats.predictNext(values.subList(Math.max(0, values.size() - PREDICTION_POINTS), values.size()))
                : average;

        return new TrendAnalysis(metric, direction, changePercent, average, min, max, stddev, predicted, values.size());
    }

    /**
     * Forecasts for every tracked percentage metric (names ending in {@code _percent}).
     */
    public List<CapacityForecast> capacityForecasts(Instant now) {
        List<CapacityForecast> forecasts = new ArrayList<>();
        for (String metric : store.metricNames()) {
            if (metric.endsWith("_percent")) {
                capacityForecast(metric, now).ifPresent(forecasts::add);
            }
        }
        return forecasts;
    }

    /**
     * Project a metric 7 and 30 days ahead from its daily rate of change.
     * <p>
     * The rate compares the last 24 hours with the same day one week earlier,
     * or with the first day of data when history is shorter than that.
     */
    public Optional<CapacityForecast> capacityForecast(String metric, Instant now) {
        List<MetricSample> history = store.query(metric, now.minus(FORECAST_HISTORY), now);
        if (history.size() < FORECAST_MIN_SAMPLES) {
            log.debug("Not enough history to forecast {} ({} samples)", metric, history.size());
            return Optional.empty();
        }

        double current = history.get(history.size() - 1).value();
        List<Double> recent = values(metric, now.minus(Duration.ofDays(1)), now);
        double recentAvg = recent.isEmpty() ? current : Stats.mean(recent);

        List<Double> weekAgo = values(metric, now.minus(Duration.ofDays(8)), now.minus(Duration.ofDays(7)));
        double earlierAvg;
        double days;
        if (!weekAgo.isEmpty()) {
            earlierAvg = Stats.mean(weekAgo);
            days = 7.0;
        } else {
            Instant first = history.get(0).timestamp();
            earlierAvg = Stats.mean(values(metric, first, first.plus(Duration.ofDays(1))));
            days = Math.max(1.0, Duration.between(first, now).toSeconds() / 86400.0);
        }
        double dailyRate = (recentAvg - earlierAvg) / days;

        double predicted7d = current + dailyRate * 7;
        double predicted30d = current + dailyRate * 30;

        Instant exhaustion = null;
        if (dailyRate > 0) {
            double daysToExhaustion = (CAPACITY_CEILING_PERCENT - current) / dailyRate;
            if (daysToExhaustion > 0 && daysToExhaustion < 365) {
                exhaustion = now.plusSeconds((long) (daysToExhaustion * 86400));
            }
        }

        String action;
        if (predicted30d > 90) {
            action = "Urgent: expand capacity or optimize now";
        } else if (predicted30d > 80) {
            action = "Warning: plan a capacity expansion";
        } else if (predicted7d > 85) {
            action = "Notice: watch the usage trend";
        } else {
            action = "Normal: keep monitoring";
        }

        double confidence = Math.min(0.95, history.size() / (24.0 * 30));

        return Optional.of(new CapacityForecast(metric, current, dailyRate, predicted7d, predicted30d,
                exhaustion, action, confidence));
    }

    /**
     * Average samples per metric and clock hour. Output is ordered by hour, then metric name.
     */
    public static List<MetricSample> aggregateHourly(List<MetricSample> samples) {
        Map<Instant, Map<String, List<Double>>> buckets = new TreeMap<>();
        for (MetricSample sample : samples) {
            Instant hour = sample.timestamp().truncatedTo(ChronoUnit.HOURS);
            buckets.computeIfAbsent(hour, h -> new TreeMap<>())
                    .computeIfAbsent(sample.metricName(), m -> new ArrayList<>())
                    .add(sample.value());
        }
        List<MetricSample> aggregated = new ArrayList<>();
        buckets.forEach((hour, byMetric) -> byMetric.forEach((metric, values) ->
                aggregated.add(new MetricSample(metric, Stats.mean(values), hour))));
        return aggregated;
    }

    private List<Double> values(String metric, Instant since, Instant until) {
        return store.query(metric, since, until).stream().map(MetricSample::value).toList();
    }
}
