package com.example.hostmonitor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lifecycle episode of a rule firing, from trigger to
 * acknowledgement, suppression or resolution.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    private String id;

    private String ruleId;

    private String ruleName;

    private Level level;

    private Category category;

    private Status status;

    private String title;

    private String message;

    /** Metric value at the moment the incident opened */
    private double metricValue;

    private double threshold;

    private Instant startedAt;

    private Instant resolvedAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    private Instant suppressedUntil;

    private Instant lastNotificationAt;

    @Builder.Default
    private int notificationCount = 0;

    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    public enum Level {
        INFO, WARNING, CRITICAL, EMERGENCY
    }

    public enum Status {
        ACTIVE, ACKNOWLEDGED, RESOLVED, SUPPRESSED
    }

    public enum Category {
        SYSTEM, PERFORMANCE, SECURITY, SERVICE, NETWORK, STORAGE
    }

    /** Active or acknowledged: the incident belongs in the active index. */
    @JsonIgnore
    public boolean isOpen() {
        return status == Status.ACTIVE || status == Status.ACKNOWLEDGED;
    }

    @JsonIgnore
    public boolean isSuppressedAt(Instant now) {
        return status == Status.SUPPRESSED && suppressedUntil != null && suppressedUntil.isAfter(now);
    }

    public Incident copy() {
        return toBuilder()
                .tags(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>())
                .context(context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>())
                .build();
    }
}
