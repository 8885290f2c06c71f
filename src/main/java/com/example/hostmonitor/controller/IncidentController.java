package com.example.hostmonitor.controller;

import com.example.hostmonitor.alert.IncidentManager;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.domain.IncidentFilter;
import com.example.hostmonitor.domain.IncidentSummary;
import com.example.hostmonitor.error.NotFoundException;
import com.example.hostmonitor.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Incident Management REST API Controller.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class IncidentController {

    static final int DEFAULT_SUPPRESS_MINUTES = 60;
    static final int MAX_SUPPRESS_MINUTES = 30 * 24 * 60;

    private final IncidentManager incidentManager;
    private final Clock clock;

    /**
     * List incidents, newest first.
     */
    @GetMapping("/incidents")
    public ResponseEntity<?> listIncidents(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String ruleId,
            @RequestParam(required = false) Integer hours,
            @RequestParam(defaultValue = "50") int limit) {
        try {
            IncidentFilter filter = IncidentFilter.builder()
                    .status(status != null ? Incident.Status.valueOf(status.toUpperCase()) : null)
                    .level(level != null ? Incident.Level.valueOf(level.toUpperCase()) : null)
                    .ruleId(ruleId)
                    .since(hours != null ? Instant.now(clock).minus(Duration.ofHours(hours)) : null)
                    .limit(Math.max(1, Math.min(limit, 1000)))
                    .build();
            return ResponseEntity.ok(incidentManager.list(filter));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/incidents/active")
    public ResponseEntity<List<Incident>> getActiveIncidents() {
        return ResponseEntity.ok(incidentManager.active());
    }

    @GetMapping("/incidents/{id}")
    public ResponseEntity<Incident> getIncident(@PathVariable String id) {
        return incidentManager.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Operator action on an incident: acknowledge, resolve or suppress.
     */
    @PostMapping("/incidents/{id}/action")
    public ResponseEntity<?> applyAction(@PathVariable String id, @RequestBody Map<String, Object> body) {
        String action = body.get("action") != null ? body.get("action").toString().toLowerCase() : "";
        String comment = body.get("comment") != null ? body.get("comment").toString() : null;
        String user = body.get("user") != null ? body.get("user").toString() : "user";
        try {
            Incident updated = switch (action) {
                case "acknowledge" -> incidentManager.acknowledge(id, user, comment);
                case "resolve" -> incidentManager.resolve(id, comment);
                case "suppress" -> incidentManager.suppress(id, suppressMinutes(body.get("suppressMinutes")));
                default -> throw new ValidationException("Unknown action: " + action);
            };
            return ResponseEntity.ok(updated);
        } catch (NotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/summary")
    public ResponseEntity<IncidentSummary> getSummary() {
        return ResponseEntity.ok(incidentManager.summary(Instant.now(clock)));
    }

    /**
     * Whole minutes only; fractional, non-numeric and out-of-range values are rejected.
     */
    static int suppressMinutes(Object value) {
        if (value == null) return DEFAULT_SUPPRESS_MINUTES;
        long minutes;
        try {
            minutes = new BigDecimal(value.toString().trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException("suppressMinutes must be a whole number of minutes: " + value);
        }
        if (minutes < 1 || minutes > MAX_SUPPRESS_MINUTES) {
            throw new ValidationException("suppressMinutes must be between 1 and " + MAX_SUPPRESS_MINUTES);
        }
        return (int) minutes;
    }
}
