package com.example.hostmonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial update of an {@link AlertRule}. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRulePatch {

    private String name;
    private String description;
    private Incident.Category category;
    private String metric;
    private AlertRule.Condition condition;
    private Double threshold;
    private Incident.Level level;
    private Integer durationSeconds;
    private Integer cooldownSeconds;
    private Boolean autoResolve;
    private Boolean enabled;
    private Set<String> notificationChannels;
    private Map<String, String> tags;

    /**
     * Apply the set fields to a copy of {@code rule}; the argument is not modified.
     */
    public AlertRule applyTo(AlertRule rule) {
        AlertRule patched = rule.copy();
        if (name != null) patched.setName(name);
        if (description != null) patched.setDescription(description);
        if (category != null) patched.setCategory(category);
        if (metric != null) patched.setMetric(metric);
        if (condition != null) patched.setCondition(condition);
        if (threshold != null) patched.setThreshold(threshold);
        if (level != null) patched.setLevel(level);
        if (durationSeconds != null) patched.setDurationSeconds(durationSeconds);
        if (cooldownSeconds != null) patched.setCooldownSeconds(cooldownSeconds);
        if (autoResolve != null) patched.setAutoResolve(autoResolve);
        if (enabled != null) patched.setEnabled(enabled);
        if (notificationChannels != null) patched.setNotificationChannels(new LinkedHashSet<>(notificationChannels));
        if (tags != null) patched.setTags(new LinkedHashMap<>(tags));
        return patched;
    }
}
