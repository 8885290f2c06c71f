package com.example.hostmonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Listing criteria for incidents. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentFilter {

    private Incident.Status status;
    private Incident.Level level;
    private String ruleId;
    private Instant since;
    private Instant until;

    @Builder.Default
    private int limit = 50;

    public boolean matches(Incident incident) {
        if (status != null && incident.getStatus() != status) return false;
        if (level != null && incident.getLevel() != level) return false;
        if (ruleId != null && !ruleId.equals(incident.getRuleId())) return false;
        if (since != null && incident.getStartedAt().isBefore(since)) return false;
        if (until != null && incident.getStartedAt().isAfter(until)) return false;
        return true;
    }
}
