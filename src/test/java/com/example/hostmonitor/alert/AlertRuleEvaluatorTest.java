package com.example.hostmonitor.alert;

import com.example.hostmonitor.MutableClock;
import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.domain.IncidentFilter;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.notification.NotificationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AlertRuleEvaluatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private IncidentManager incidentManager;
    private NotificationService notificationService;
    private SimpleMeterRegistry meterRegistry;
    private AlertRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        incidentManager = new IncidentManager(new MutableClock(T0));
        notificationService = mock(NotificationService.class);
        meterRegistry = new SimpleMeterRegistry();
        evaluator = new AlertRuleEvaluator(incidentManager, notificationService, meterRegistry);
    }

    private static AlertRule rule(String id, AlertRule.Condition condition, double threshold,
                                  int durationSeconds, int cooldownSeconds) {
        return AlertRule.builder()
                .id(id)
                .name("rule " + id)
                .metric("cpu_percent")
                .condition(condition)
                .threshold(threshold)
                .durationSeconds(durationSeconds)
                .cooldownSeconds(cooldownSeconds)
                .notificationChannels(new LinkedHashSet<>(List.of("default")))
                .build();
    }

    private static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    private List<Incident> incidents() {
        return incidentManager.list(IncidentFilter.builder().limit(100).build());
    }

    @Test
    void cpuScenarioDebouncesThenRespectsCooldown() {
        AlertRule cpu = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 120, 300);

        for (long t = 0; t <= 90; t += 30) {
            assertFalse(evaluator.evaluateRule(cpu, 85, at(t)), "no incident before 120s, t=" + t);
        }
        assertTrue(evaluator.evaluateRule(cpu, 85, at(120)));
        assertEquals(1, incidents().size());
        assertEquals(at(120), incidents().get(0).getStartedAt());

        assertFalse(evaluator.evaluateRule(cpu, 85, at(150)));
        assertFalse(evaluator.evaluateRule(cpu, 85, at(419)));
        assertEquals(1, incidents().size());

        assertTrue(evaluator.evaluateRule(cpu, 85, at(430)));
        assertEquals(2, incidents().size());
        verify(notificationService, times(2)).dispatch(any(Incident.class), anyCollection());
        assertEquals(2.0, meterRegistry.get("hostmonitor.incidents.created").counter().count());
    }

    @Test
    void zeroDurationFiresOnFirstTriggeringSample() {
        AlertRule instant = rule("now", AlertRule.Condition.GREATER_THAN, 80, 0, 300);

        assertTrue(evaluator.evaluateRule(instant, 81, at(0)));
        assertEquals(1, incidentManager.active().size());
    }

    @Test
    void durationBoundaryIsInclusive() {
        AlertRule r = rule("edge", AlertRule.Condition.GREATER_THAN_OR_EQUAL, 90, 60, 600);

        assertFalse(evaluator.evaluateRule(r, 90, at(0)));
        assertFalse(evaluator.evaluateRule(r, 95, at(59)));
        assertTrue(evaluator.evaluateRule(r, 95, at(60)));
    }

    @Test
    void interruptedConditionRestartsDebounce() {
        AlertRule r = rule("flap", AlertRule.Condition.GREATER_THAN, 80, 60, 300);

        evaluator.evaluateRule(r, 85, at(0));
        evaluator.evaluateRule(r, 70, at(30));
        assertFalse(evaluator.evaluateRule(r, 85, at(60)));
        assertEquals(at(60), evaluator.stateOf("flap").orElseThrow().getTriggeredAt());
        assertTrue(evaluator.evaluateRule(r, 85, at(120)));
    }

    @Test
    void recoveryAutoResolvesAndSecondRecoveryIsNoOp() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 0, 300);
        evaluator.evaluateRule(r, 90, at(0));
        Incident incident = incidentManager.active().get(0);

        evaluator.evaluateRule(r, 50, at(30));

        Incident resolved = incidentManager.find(incident.getId()).orElseThrow();
        assertEquals(Incident.Status.RESOLVED, resolved.getStatus());
        assertEquals(at(30), resolved.getResolvedAt());
        assertTrue(incidentManager.active().isEmpty());
        assertEquals(0, evaluator.stateOf("cpu").orElseThrow().getConsecutiveTriggers());

        evaluator.evaluateRule(r, 50, at(60));
        assertEquals(at(30), incidentManager.find(incident.getId()).orElseThrow().getResolvedAt());
    }

    @Test
    void withoutAutoResolveIncidentStaysOpen() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 0, 300).toBuilder()
                .autoResolve(false)
                .build();
        evaluator.evaluateRule(r, 90, at(0));

        evaluator.evaluateRule(r, 50, at(30));

        assertEquals(1, incidentManager.active().size());
        assertFalse(evaluator.stateOf("cpu").orElseThrow().isTriggering());
    }

    @Test
    void equalityUsesEpsilon() {
        assertTrue(AlertRule.Condition.EQUALS.test(50.0049, 50.0));
        assertFalse(AlertRule.Condition.EQUALS.test(50.02, 50.0));
        assertFalse(AlertRule.Condition.NOT_EQUALS.test(50.0049, 50.0));
        assertTrue(AlertRule.Condition.NOT_EQUALS.test(50.02, 50.0));

        AlertRule r = rule("eq", AlertRule.Condition.EQUALS, 50.0, 0, 300);
        assertTrue(evaluator.evaluateRule(r, 50.0049, at(0)));
    }

    @Test
    void acknowledgedIncidentSilencesRule() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 0, 60);
        evaluator.evaluateRule(r, 90, at(0));
        incidentManager.acknowledge(incidentManager.active().get(0).getId(), "alice", null);

        assertFalse(evaluator.evaluateRule(r, 90, at(120)));
        assertEquals(1, incidents().size());
        assertEquals(at(0), evaluator.stateOf("cpu").orElseThrow().getLastNotification());
    }

    @Test
    void acknowledgedIncidentDoesNotSilenceNextEpisode() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 0, 60);
        assertTrue(evaluator.evaluateRule(r, 95, at(0)));
        Incident first = incidentManager.active().get(0);
        incidentManager.acknowledge(first.getId(), "alice", null);

        // recovery leaves the acknowledged incident open
        assertFalse(evaluator.evaluateRule(r, 50, at(60)));
        assertEquals(Incident.Status.ACKNOWLEDGED, incidentManager.find(first.getId()).orElseThrow().getStatus());

        long twoDays = 2 * 24 * 3600;
        assertTrue(evaluator.evaluateRule(r, 95, at(twoDays)));
        assertEquals(2, incidents().size());
        assertEquals(at(twoDays), incidents().get(0).getStartedAt());
    }

    @Test
    void redefiningRuleRestartsDebounce() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 120, 300);
        assertFalse(evaluator.evaluateRule(r, 90, at(0)));
        assertFalse(evaluator.evaluateRule(r, 90, at(60)));

        AlertRule raised = r.copy();
        raised.setThreshold(85);

        assertFalse(evaluator.evaluateRule(raised, 90, at(120)));
        assertEquals(at(120), evaluator.stateOf("cpu").orElseThrow().getTriggeredAt());
        assertTrue(evaluator.evaluateRule(raised, 90, at(240)));
    }

    @Test
    void unchangedDefinitionKeepsEpisode() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 120, 300);
        evaluator.evaluateRule(r, 90, at(0));

        AlertRule renamed = r.copy();
        renamed.setName("renamed");

        assertTrue(evaluator.evaluateRule(renamed, 90, at(120)));
    }

    @Test
    void suppressionSilencesUntilItExpires() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 0, 60);
        evaluator.evaluateRule(r, 90, at(0));
        // suppressed for 10 minutes from the manager's clock (T0)
        incidentManager.suppress(incidentManager.active().get(0).getId(), 10);

        assertFalse(evaluator.evaluateRule(r, 90, at(300)));
        assertTrue(evaluator.evaluateRule(r, 90, at(600)));
        assertEquals(2, incidents().size());
    }

    @Test
    void failingRuleDoesNotStopOthers() {
        AlertRule broken = rule("broken", null, 80, 0, 300);
        AlertRule healthy = rule("healthy", AlertRule.Condition.GREATER_THAN, 80, 0, 300);

        int opened = evaluator.evaluate(new MetricSample("cpu_percent", 90, at(0)), List.of(broken, healthy));

        assertEquals(1, opened);
        assertEquals(1.0, meterRegistry.get("hostmonitor.rule.evaluation.errors").counter().count());
    }

    @Test
    void retainStatesForgetsRemovedRules() {
        AlertRule r = rule("cpu", AlertRule.Condition.GREATER_THAN, 80, 60, 300);
        evaluator.evaluateRule(r, 90, at(0));

        evaluator.retainStates(Set.of());

        assertTrue(evaluator.stateOf("cpu").isEmpty());
        verify(notificationService, never()).dispatch(any(), anyCollection());
    }
}
