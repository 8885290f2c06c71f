package com.example.hostmonitor.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over all incidents, computed on demand.
 *
 * @param byLevel        open incidents per level
 * @param topCategories  open incidents per category, largest first
 */
public record IncidentSummary(
        int total,
        int active,
        Map<Incident.Level, Long> byLevel,
        long acknowledged,
        long resolvedToday,
        double avgResolutionMinutes,
        Map<Incident.Category, Long> topCategories,
        long todayIncidents,
        long weekIncidents,
        Instant generatedAt) {
}
