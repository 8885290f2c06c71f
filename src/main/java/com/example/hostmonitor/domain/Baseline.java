package com.example.hostmonitor.domain;

import java.time.Instant;

/**
 * Rolling statistical profile of one metric. Replaced wholesale on every recompute.
 */
public record Baseline(
        String metricName,
        double mean,
        double stddev,
        double upperThreshold,
        double lowerThreshold,
        double confidenceLevel,
        int sampleCount,
        Instant lastUpdated) {

    /** Two standard deviations either side of the mean, roughly a 95% band */
    public static final double THRESHOLD_SIGMAS = 2.0;
    public static final double CONFIDENCE_LEVEL = 0.95;

    public static Baseline of(String metricName, double mean, double stddev, int sampleCount, Instant now) {
        double upper = mean + THRESHOLD_SIGMAS * stddev;
        double lower = Math.max(0.0, mean - THRESHOLD_SIGMAS * stddev);
        return new Baseline(metricName, mean, stddev, upper, lower, CONFIDENCE_LEVEL, sampleCount, now);
    }
}
