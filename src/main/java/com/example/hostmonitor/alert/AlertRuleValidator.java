package com.example.hostmonitor.alert;

import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects malformed rule definitions before they reach the registry.
 */
final class AlertRuleValidator {

    static final int MAX_WINDOW_SECONDS = 86_400;

    private AlertRuleValidator() {
    }

    static void validate(AlertRule rule) {
        List<String> problems = new ArrayList<>();

        if (rule.getName() == null || rule.getName().isBlank()) {
            problems.add("name is required");
        }
        if (rule.getMetric() == null || rule.getMetric().isBlank()) {
            problems.add("metric is required");
        }
        if (rule.getCondition() == null) {
            problems.add("condition is required");
        }
        if (rule.getLevel() == null) {
            problems.add("level is required");
        }
        if (rule.getCategory() == null) {
            problems.add("category is required");
        }
        if (!Double.isFinite(rule.getThreshold())) {
            problems.add("threshold must be a finite number");
        }
        if (rule.getDurationSeconds() < 0 || rule.getDurationSeconds() > MAX_WINDOW_SECONDS) {
            problems.add("durationSeconds must be between 0 and " + MAX_WINDOW_SECONDS);
        }
        if (rule.getCooldownSeconds() < 0 || rule.getCooldownSeconds() > MAX_WINDOW_SECONDS) {
            problems.add("cooldownSeconds must be between 0 and " + MAX_WINDOW_SECONDS);
        }
        if (rule.getNotificationChannels() != null
                && rule.getNotificationChannels().stream().anyMatch(c -> c == null || c.isBlank())) {
            problems.add("notificationChannels must not contain blank ids");
        }

        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }
}
