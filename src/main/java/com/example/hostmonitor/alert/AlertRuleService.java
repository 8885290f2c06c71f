package com.example.hostmonitor.alert;

import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.AlertRulePatch;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.error.NotFoundException;
import com.example.hostmonitor.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Registry of alert rules.
 * <p>
 * Stored rules are never handed out directly: readers get copies and every
 * write replaces the map entry wholesale, so the sampling loop always sees
 * a consistent rule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertRuleService {

    private final Clock clock;

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public List<AlertRule> list() {
        return rules.values().stream()
                .sorted(Comparator.comparing(AlertRule::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(AlertRule::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(AlertRule::copy)
                .collect(Collectors.toList());
    }

    public Optional<AlertRule> find(String id) {
        return Optional.ofNullable(rules.get(id)).map(AlertRule::copy);
    }

    /**
     * Validate and register a new rule under a fresh id.
     */
    public AlertRule create(AlertRule draft) {
        AlertRuleValidator.validate(draft);
        Instant now = Instant.now(clock);
        AlertRule rule = draft.copy();
        rule.setId(UUID.randomUUID().toString());
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        rules.put(rule.getId(), rule);
        version.incrementAndGet();
        log.info("Created alert rule {} ({} {} {})", rule.getName(), rule.getMetric(),
                rule.getCondition().getSymbol(), rule.getThreshold());
        return rule.copy();
    }

    /**
     * Apply a partial update. The patched rule is validated before it replaces the stored one.
     */
    public AlertRule update(String id, AlertRulePatch patch) {
        AlertRule existing = rules.get(id);
        if (existing == null) {
            throw NotFoundException.rule(id);
        }
        AlertRule patched = patch.applyTo(existing);
        AlertRuleValidator.validate(patched);
        patched.setId(id);
        patched.setCreatedAt(existing.getCreatedAt());
        patched.setUpdatedAt(Instant.now(clock));
        rules.put(id, patched);
        version.incrementAndGet();
        log.info("Updated alert rule {}", patched.getName());
        return patched.copy();
    }

    public void delete(String id) {
        AlertRule removed = rules.remove(id);
        if (removed == null) {
            throw NotFoundException.rule(id);
        }
        version.incrementAndGet();
        log.info("Deleted alert rule {}", removed.getName());
    }

    /**
     * Flip the enabled flag. Disabling does not resolve incidents the rule already opened.
     */
    public AlertRule toggle(String id) {
        AlertRule existing = rules.get(id);
        if (existing == null) {
            throw NotFoundException.rule(id);
        }
        AlertRule toggled = existing.copy();
        toggled.setEnabled(!existing.isEnabled());
        toggled.setUpdatedAt(Instant.now(clock));
        rules.put(id, toggled);
        version.incrementAndGet();
        log.info("Alert rule {} {}", toggled.getName(), toggled.isEnabled() ? "enabled" : "disabled");
        return toggled.copy();
    }

    public List<AlertRule> enabledRulesFor(String metric) {
        return rules.values().stream()
                .filter(AlertRule::isEnabled)
                .filter(r -> metric.equals(r.getMetric()))
                .map(AlertRule::copy)
                .collect(Collectors.toList());
    }

    public Set<String> enabledRuleIds() {
        return rules.values().stream()
                .filter(AlertRule::isEnabled)
                .map(AlertRule::getId)
                .collect(Collectors.toSet());
    }

    public int count() {
        return rules.size();
    }

    /**
     * Install the stock host rules (CPU, memory, disk, load) when the registry is empty.
     */
    public int installDefaults() {
        if (!rules.isEmpty()) return 0;
        List<AlertRule> defaults = List.of(
                defaultRule("High CPU usage", "CPU usage above 80% for 2 minutes",
                        Incident.Category.PERFORMANCE, "cpu_percent", 80.0, Incident.Level.WARNING, 120, 300),
                defaultRule("Critical memory usage", "Memory usage above 90%",
                        Incident.Category.PERFORMANCE, "memory_percent", 90.0, Incident.Level.CRITICAL, 60, 600),
                defaultRule("Low disk space", "Disk usage above 85%",
                        Incident.Category.STORAGE, "disk_percent", 85.0, Incident.Level.WARNING, 300, 1800),
                defaultRule("High system load", "1-minute load average above 4",
                        Incident.Category.PERFORMANCE, "load_avg_1min", 4.0, Incident.Level.WARNING, 180, 300));
        defaults.forEach(this::create);
        log.info("Installed {} default alert rules", defaults.size());
        return defaults.size();
    }

    private static AlertRule defaultRule(String name, String description, Incident.Category category,
                                         String metric, double threshold, Incident.Level level,
                                         int durationSeconds, int cooldownSeconds) {
        return AlertRule.builder()
                .name(name)
                .description(description)
                .category(category)
                .metric(metric)
                .condition(AlertRule.Condition.GREATER_THAN)
                .threshold(threshold)
                .level(level)
                .durationSeconds(durationSeconds)
                .cooldownSeconds(cooldownSeconds)
                .notificationChannels(new LinkedHashSet<>(List.of("default")))
                .build();
    }

    /**
     * Replace the registry with persisted rules. Invalid entries are skipped.
     */
    public void restore(Collection<AlertRule> restored) {
        rules.clear();
        for (AlertRule rule : restored) {
            if (rule.getId() == null) {
                log.warn("Skipping persisted rule without id: {}", rule.getName());
                continue;
            }
            try {
                AlertRuleValidator.validate(rule);
                rules.put(rule.getId(), rule.copy());
            } catch (ValidationException e) {
                log.warn("Skipping invalid persisted rule {}: {}", rule.getId(), e.getMessage());
            }
        }
        log.info("Restored {} alert rules", rules.size());
    }

    public Map<String, AlertRule> snapshot() {
        Map<String, AlertRule> copy = new LinkedHashMap<>();
        list().forEach(rule -> copy.put(rule.getId(), rule));
        return copy;
    }

    public long version() {
        return version.get();
    }
}
