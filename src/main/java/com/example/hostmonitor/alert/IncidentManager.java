package com.example.hostmonitor.alert;

import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.domain.IncidentFilter;
import com.example.hostmonitor.domain.IncidentSummary;
import com.example.hostmonitor.error.NotFoundException;
import com.example.hostmonitor.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the canonical incident collection and the active-incident index.
 * <p>
 * The index holds every open (active or acknowledged) incident. A status
 * write and the matching index update always happen under the same write
 * lock. Readers get copies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncidentManager {

    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Incident> incidents = new LinkedHashMap<>();
    private final Map<String, Incident> activeIndex = new LinkedHashMap<>();
    private final AtomicLong version = new AtomicLong();

    // ── Lifecycle ──

    /**
     * Open a new incident for {@code rule} and add it to the active index.
     */
    public Incident create(AlertRule rule, double value, Instant now) {
        String description = rule.getDescription() != null && !rule.getDescription().isBlank()
                ? rule.getDescription() : rule.getName();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("metric", rule.getMetric());
        context.put("condition", rule.getCondition().getSymbol());

        Incident incident = Incident.builder()
                .id(UUID.randomUUID().toString())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .level(rule.getLevel())
                .category(rule.getCategory())
                .status(Incident.Status.ACTIVE)
                .title(rule.getName() + " - " + rule.getLevel().name())
                .message(String.format("%s. Current value: %.2f, threshold: %s",
                        description, value, rule.getThreshold()))
                .metricValue(value)
                .threshold(rule.getThreshold())
                .startedAt(now)
                .tags(rule.getTags() != null ? new LinkedHashMap<>(rule.getTags()) : new LinkedHashMap<>())
                .context(context)
                .build();

        lock.writeLock().lock();
        try {
            incidents.put(incident.getId(), incident);
            activeIndex.put(incident.getId(), incident);
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("Incident opened: {} ({})", incident.getTitle(), incident.getMessage());
        return incident.copy();
    }

    /**
     * Mark an incident acknowledged. It stays in the active index.
     */
    public Incident acknowledge(String id, String user, String comment) {
        Instant now = Instant.now(clock);
        lock.writeLock().lock();
        try {
            Incident incident = require(id);
            if (incident.getStatus() == Incident.Status.RESOLVED) {
                throw new ValidationException("Incident " + id + " is already resolved");
            }
            incident.setStatus(Incident.Status.ACKNOWLEDGED);
            incident.setAcknowledgedAt(now);
            incident.setAcknowledgedBy(user != null ? user : "system");
            if (comment != null && !comment.isBlank()) {
                incident.getContext().put("acknowledgment_comment", comment);
            }
            activeIndex.put(id, incident);
            version.incrementAndGet();
            log.info("Incident acknowledged: {} by {}", incident.getTitle(), incident.getAcknowledgedBy());
            return incident.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resolve an incident and drop it from the active index. Resolving twice is a no-op.
     */
    public Incident resolve(String id, String comment) {
        Instant now = Instant.now(clock);
        lock.writeLock().lock();
        try {
            Incident incident = require(id);
            if (incident.getStatus() == Incident.Status.RESOLVED) {
                return incident.copy();
            }
            resolveLocked(incident, now);
            if (comment != null && !comment.isBlank()) {
                incident.getContext().put("resolution_comment", comment);
            }
            log.info("Incident resolved: {}", incident.getTitle());
            return incident.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Suppress an incident for {@code durationMinutes}. There is no automatic
     * reactivation; the evaluator only consults {@code suppressedUntil} when the
     * rule would otherwise fire again.
     */
    public Incident suppress(String id, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new ValidationException("Suppression duration must be positive");
        }
        Instant now = Instant.now(clock);
        lock.writeLock().lock();
        try {
            Incident incident = require(id);
            if (incident.getStatus() == Incident.Status.RESOLVED) {
                throw new ValidationException("Incident " + id + " is already resolved");
            }
            incident.setStatus(Incident.Status.SUPPRESSED);
            incident.setSuppressedUntil(now.plus(Duration.ofMinutes(durationMinutes)));
            activeIndex.remove(id);
            version.incrementAndGet();
            log.info("Incident suppressed for {} minutes: {}", durationMinutes, incident.getTitle());
            return incident.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resolve every ACTIVE incident opened by {@code ruleId}. Acknowledged ones are left for the operator.
     *
     * @return number of incidents resolved
     */
    public int autoResolve(String ruleId, Instant now) {
        lock.writeLock().lock();
        try {
            List<Incident> toResolve = activeIndex.values().stream()
                    .filter(i -> ruleId.equals(i.getRuleId()) && i.getStatus() == Incident.Status.ACTIVE)
                    .toList();
            for (Incident incident : toResolve) {
                resolveLocked(incident, now);
                log.info("Auto-resolved incident: {}", incident.getTitle());
            }
            return toResolve.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordNotification(String id, Instant sentAt) {
        lock.writeLock().lock();
        try {
            Incident incident = incidents.get(id);
            if (incident == null) return;
            incident.setNotificationCount(incident.getNotificationCount() + 1);
            incident.setLastNotificationAt(sentAt);
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void resolveLocked(Incident incident, Instant now) {
        incident.setStatus(Incident.Status.RESOLVED);
        incident.setResolvedAt(now);
        activeIndex.remove(incident.getId());
        version.incrementAndGet();
    }

    private Incident require(String id) {
        Incident incident = incidents.get(id);
        if (incident == null) {
            throw NotFoundException.incident(id);
        }
        return incident;
    }

    // ── Query ──

    public Optional<Incident> find(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(incidents.get(id)).map(Incident::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Matching incidents, newest first, capped at the filter's limit.
     */
    public List<Incident> list(IncidentFilter filter) {
        lock.readLock().lock();
        try {
            return incidents.values().stream()
                    .filter(filter::matches)
                    .sorted(Comparator.comparing(Incident::getStartedAt).reversed())
                    .limit(Math.max(0, filter.getLimit()))
                    .map(Incident::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Incident> active() {
        lock.readLock().lock();
        try {
            return activeIndex.values().stream().map(Incident::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when the rule must not open another incident right now: an operator
     * has acknowledged an incident of the current episode (opened at or after
     * {@code episodeStart}), or suppressed one until after {@code now}.
     * Acknowledgements from earlier episodes do not count.
     */
    public boolean isSilenced(String ruleId, Instant episodeStart, Instant now) {
        lock.readLock().lock();
        try {
            for (Incident incident : incidents.values()) {
                if (!ruleId.equals(incident.getRuleId())) continue;
                if (incident.isSuppressedAt(now)) {
                    return true;
                }
                if (incident.getStatus() == Incident.Status.ACKNOWLEDGED
                        && (episodeStart == null || !incident.getStartedAt().isBefore(episodeStart))) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    public IncidentSummary summary(Instant now) {
        Instant startOfDay = LocalDate.ofInstant(now, clock.getZone()).atStartOfDay(clock.getZone()).toInstant();
        Instant weekAgo = now.minus(Duration.ofDays(7));

        lock.readLock().lock();
        try {
            Map<Incident.Level, Long> byLevel = new EnumMap<>(Incident.Level.class);
            for (Incident.Level level : Incident.Level.values()) {
                byLevel.put(level, 0L);
            }
            activeIndex.values().forEach(i -> byLevel.merge(i.getLevel(), 1L, Long::sum));

            long acknowledged = activeIndex.values().stream()
                    .filter(i -> i.getStatus() == Incident.Status.ACKNOWLEDGED)
                    .count();

            long resolvedToday = incidents.values().stream()
                    .filter(i -> i.getResolvedAt() != null && !i.getResolvedAt().isBefore(startOfDay))
                    .count();

            double avgResolutionMinutes = incidents.values().stream()
                    .filter(i -> i.getResolvedAt() != null)
                    .mapToDouble(i -> Duration.between(i.getStartedAt(), i.getResolvedAt()).toMillis() / 60_000.0)
                    .average()
                    .orElse(0.0);

            Map<Incident.Category, Long> topCategories = activeIndex.values().stream()
                    .collect(Collectors.groupingBy(Incident::getCategory, Collectors.counting()))
                    .entrySet().stream()
                    .sorted(Map.Entry.<Incident.Category, Long>comparingByValue().reversed())
                    .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                            (a, b) -> a, LinkedHashMap::new));

            long todayIncidents = incidents.values().stream()
                    .filter(i -> !i.getStartedAt().isBefore(startOfDay))
                    .count();
            long weekIncidents = incidents.values().stream()
                    .filter(i -> !i.getStartedAt().isBefore(weekAgo))
                    .count();

            return new IncidentSummary(incidents.size(), activeIndex.size(), byLevel, acknowledged,
                    resolvedToday, avgResolutionMinutes, topCategories, todayIncidents, weekIncidents, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Snapshot support ──

    /**
     * Replace all incidents with persisted ones, rebuilding the active index from their status.
     */
    public void restore(Collection<Incident> restored) {
        lock.writeLock().lock();
        try {
            incidents.clear();
            activeIndex.clear();
            Map<String, Incident> byId = restored.stream()
                    .filter(i -> i.getId() != null && i.getStartedAt() != null && i.getStatus() != null)
                    .map(Incident::copy)
                    .collect(Collectors.toMap(Incident::getId, Function.identity(), (a, b) -> b, LinkedHashMap::new));
            byId.values().stream()
                    .sorted(Comparator.comparing(Incident::getStartedAt))
                    .forEach(incident -> {
                        incidents.put(incident.getId(), incident);
                        if (incident.isOpen()) {
                            activeIndex.put(incident.getId(), incident);
                        }
                    });
            log.info("Restored {} incidents ({} active)", incidents.size(), activeIndex.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Incident> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Incident> copy = new LinkedHashMap<>();
            incidents.forEach((id, incident) -> copy.put(id, incident.copy()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long version() {
        return version.get();
    }
}
