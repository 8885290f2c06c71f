package com.example.hostmonitor.controller;

import com.example.hostmonitor.alert.AlertRuleService;
import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.AlertRulePatch;
import com.example.hostmonitor.error.NotFoundException;
import com.example.hostmonitor.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert Rules REST API Controller.
 */
@RestController
@RequestMapping("/api/alerts/rules")
@RequiredArgsConstructor
public class AlertRuleController {

    private final AlertRuleService ruleService;

    @GetMapping
    public ResponseEntity<List<AlertRule>> listRules() {
        return ResponseEntity.ok(ruleService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertRule> getRule(@PathVariable String id) {
        return ruleService.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody AlertRule rule) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.create(rule));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Partial update: only the fields present in the body change.
     */
    @PutMapping("/{id}")
    public ResponseEntity<?> updateRule(@PathVariable String id, @RequestBody AlertRulePatch patch) {
        try {
            return ResponseEntity.ok(ruleService.update(id, patch));
        } catch (NotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteRule(@PathVariable String id) {
        try {
            ruleService.delete(id);
            return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
        } catch (NotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/{id}/toggle")
    public ResponseEntity<AlertRule> toggleRule(@PathVariable String id) {
        try {
            return ResponseEntity.ok(ruleService.toggle(id));
        } catch (NotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
