package com.example.hostmonitor.controller;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.monitoring.PushSampler;
import com.example.hostmonitor.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Metric ingestion REST API Controller.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final PushSampler pushSampler;
    private final TimeSeriesStore store;
    private final MonitorProperties properties;
    private final Clock clock;

    /**
     * Queue readings for the next sampling tick. A missing timestamp means "now";
     * timestamps too far ahead of the server clock are refused. Answers 503 when
     * the push buffer is full.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> pushSamples(@RequestBody List<SampleRequest> readings) {
        Instant now = Instant.now(clock);
        Instant latestAllowed = now.plus(Duration.ofSeconds(properties.getSampling().getMaxFutureSkewSeconds()));
        List<MetricSample> samples = new ArrayList<>(readings.size());
        for (SampleRequest reading : readings) {
            if (reading.metricName() == null || reading.metricName().isBlank()) {
                return ResponseEntity.badRequest().body(Map.of("error", "metricName is required"));
            }
            if (reading.value() == null || !Double.isFinite(reading.value())) {
                return ResponseEntity.badRequest().body(Map.of("error",
                        "value for " + reading.metricName() + " must be a finite number"));
            }
            if (reading.timestamp() != null && reading.timestamp().isAfter(latestAllowed)) {
                return ResponseEntity.badRequest().body(Map.of("error",
                        "timestamp for " + reading.metricName() + " is in the future: " + reading.timestamp()));
            }
            samples.add(new MetricSample(reading.metricName(), reading.value(),
                    reading.timestamp() != null ? reading.timestamp() : now));
        }
        if (!pushSampler.push(samples)) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error",
                    "push buffer is full (" + pushSampler.capacity() + " samples), retry later"));
        }
        return ResponseEntity.accepted().body(Map.of("accepted", samples.size(), "pending", pushSampler.pending()));
    }

    /**
     * Newest stored sample of every metric.
     */
    @GetMapping("/latest")
    public ResponseEntity<Map<String, MetricSample>> getLatest() {
        return ResponseEntity.ok(store.latestAll());
    }

    public record SampleRequest(String metricName, Double value, Instant timestamp) {
    }
}
