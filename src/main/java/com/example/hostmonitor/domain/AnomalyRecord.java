package com.example.hostmonitor.domain;

import java.time.Instant;

/**
 * A sample that fell outside its metric's baseline band. Advisory only.
 */
public record AnomalyRecord(
        Instant timestamp,
        String metricName,
        double actualValue,
        double expectedValue,
        double anomalyScore,
        Severity severity,
        String description) {

    public enum Severity {
        LOW, MEDIUM, HIGH;

        /** Buckets the raw (unclamped) deviation ratio. */
        public static Severity fromRatio(double ratio) {
            if (ratio > 3) return HIGH;
            if (ratio > 2) return MEDIUM;
            return LOW;
        }
    }
}
