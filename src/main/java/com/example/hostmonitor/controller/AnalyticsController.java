package com.example.hostmonitor.controller;

import com.example.hostmonitor.analytics.AnomalyDetector;
import com.example.hostmonitor.analytics.BaselineEstimator;
import com.example.hostmonitor.analytics.TrendAnalyzer;
import com.example.hostmonitor.domain.AnomalyRecord;
import com.example.hostmonitor.domain.Baseline;
import com.example.hostmonitor.domain.CapacityForecast;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.domain.TrendAnalysis;
import com.example.hostmonitor.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analytics REST API Controller: history, baselines, anomalies, trends and capacity.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    static final int MAX_HOURS = 168;

    private final TimeSeriesStore store;
    private final BaselineEstimator baselineEstimator;
    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final Clock clock;

    /**
     * Raw or hourly-averaged samples, optionally limited to a comma-separated list of metrics.
     */
    @GetMapping("/historical")
    public ResponseEntity<?> getHistorical(
            @RequestParam(defaultValue = "24") int hours,
            @RequestParam(required = false) String metrics,
            @RequestParam(defaultValue = "raw") String aggregation) {
        if (hours < 1 || hours > MAX_HOURS) {
            return badHours();
        }
        if (!aggregation.equals("raw") && !aggregation.equals("hour")) {
            return ResponseEntity.badRequest().body(Map.of("error", "aggregation must be raw or hour"));
        }

        Instant now = Instant.now(clock);
        List<MetricSample> samples = store.query(null, now.minus(Duration.ofHours(hours)), now);
        if (metrics != null && !metrics.isBlank()) {
            Set<String> wanted = Arrays.stream(metrics.split(","))
                    .map(String::trim)
                    .filter(m -> !m.isEmpty())
                    .collect(Collectors.toSet());
            samples = samples.stream().filter(s -> wanted.contains(s.metricName())).toList();
        }
        if (aggregation.equals("hour")) {
            samples = TrendAnalyzer.aggregateHourly(samples);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataPoints", samples);
        body.put("totalPoints", samples.size());
        body.put("timeRangeHours", hours);
        body.put("aggregation", aggregation);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/baselines")
    public ResponseEntity<Map<String, Baseline>> getBaselines() {
        return ResponseEntity.ok(baselineEstimator.all());
    }

    @GetMapping("/anomalies")
    public ResponseEntity<?> getAnomalies(
            @RequestParam(defaultValue = "24") int hours,
            @RequestParam(required = false) String severity) {
        if (hours < 1 || hours > MAX_HOURS) {
            return badHours();
        }
        AnomalyRecord.Severity wanted;
        try {
            wanted = severity != null ? AnomalyRecord.Severity.valueOf(severity.toUpperCase()) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown severity: " + severity));
        }

        List<AnomalyRecord> anomalies = anomalyDetector.recent(Instant.now(clock).minus(Duration.ofHours(hours)));
        if (wanted != null) {
            anomalies = anomalies.stream().filter(a -> a.severity() == wanted).toList();
        }
        return ResponseEntity.ok(anomalies);
    }

    @GetMapping("/trends")
    public ResponseEntity<?> getTrends(@RequestParam(defaultValue = "24") int hours) {
        if (hours < 1 || hours > MAX_HOURS) {
            return badHours();
        }
        List<TrendAnalysis> trends = trendAnalyzer.trends(Duration.ofHours(hours), Instant.now(clock));
        return ResponseEntity.ok(trends);
    }

    @GetMapping("/capacity-forecast")
    public ResponseEntity<List<CapacityForecast>> getCapacityForecast() {
        return ResponseEntity.ok(trendAnalyzer.capacityForecasts(Instant.now(clock)));
    }

    private static ResponseEntity<Map<String, String>> badHours() {
        return ResponseEntity.badRequest().body(Map.of("error", "hours must be between 1 and " + MAX_HOURS));
    }
}
