package com.example.hostmonitor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A single scalar reading of a host metric. Immutable once stored.
 */
public record MetricSample(String metricName, double value, Instant timestamp) {

    public MetricSample {
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
