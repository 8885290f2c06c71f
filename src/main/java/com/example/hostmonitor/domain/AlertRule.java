package com.example.hostmonitor.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Defines an alerting rule: a metric compared against a static threshold,
 * with debounce (duration) and re-notification (cooldown) timing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    private String id;

    private String name;

    private String description;

    @Builder.Default
    private Incident.Category category = Incident.Category.SYSTEM;

    private String metric;

    private Condition condition;

    private double threshold;

    @Builder.Default
    private Incident.Level level = Incident.Level.WARNING;

    /** Seconds the condition must hold before an incident opens */
    @Builder.Default
    private int durationSeconds = 60;

    /** Minimum seconds between two incidents of the same rule */
    @Builder.Default
    private int cooldownSeconds = 300;

    @Builder.Default
    private boolean autoResolve = true;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private Set<String> notificationChannels = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Deep copy, so callers never share collections with the rule registry.
     */
    public AlertRule copy() {
        return toBuilder()
                .notificationChannels(notificationChannels != null
                        ? new LinkedHashSet<>(notificationChannels) : new LinkedHashSet<>())
                .tags(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>())
                .build();
    }

    public enum Condition {
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        EQUALS("=="),
        NOT_EQUALS("!=");

        /** Tolerance for float noise in == and != */
        public static final double EQUALITY_EPSILON = 0.01;

        private final String symbol;

        Condition(String symbol) {
            this.symbol = symbol;
        }

        @JsonValue
        public String getSymbol() {
            return symbol;
        }

        public boolean test(double value, double threshold) {
            return switch (this) {
                case GREATER_THAN -> value > threshold;
                case GREATER_THAN_OR_EQUAL -> value >= threshold;
                case LESS_THAN -> value < threshold;
                case LESS_THAN_OR_EQUAL -> value <= threshold;
                case EQUALS -> Math.abs(value - threshold) < EQUALITY_EPSILON;
                case NOT_EQUALS -> Math.abs(value - threshold) >= EQUALITY_EPSILON;
            };
        }

        /**
         * Accepts either the operator symbol (">=") or the constant name ("greater_than_or_equal").
         */
        @JsonCreator
        public static Condition from(String value) {
            if (value == null) return null;
            String trimmed = value.trim();
            for (Condition condition : values()) {
                if (condition.symbol.equals(trimmed) || condition.name().equalsIgnoreCase(trimmed)) {
                    return condition;
                }
            }
            throw new IllegalArgumentException("Unknown condition: " + value);
        }
    }
}
