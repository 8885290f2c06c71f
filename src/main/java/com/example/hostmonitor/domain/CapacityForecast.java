package com.example.hostmonitor.domain;

import java.time.Instant;

/**
 * Linear projection of a percentage metric towards its capacity ceiling.
 *
 * @param exhaustionDate null unless the ceiling is reached within a year at the current rate
 */
public record CapacityForecast(
        String metricName,
        double currentUsage,
        double dailyChangeRate,
        double predictedUsage7d,
        double predictedUsage30d,
        Instant exhaustionDate,
        String recommendedAction,
        double confidence) {
}
