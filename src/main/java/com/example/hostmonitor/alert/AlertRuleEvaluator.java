package com.example.hostmonitor.alert;

import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.notification.NotificationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alert Rule Evaluator - runs each rule's debounce/cooldown state machine
 * against incoming samples.
 * <p>
 * A triggering condition must hold for the rule's duration before an incident
 * is opened; while it keeps holding, at most one incident is opened per
 * cooldown period. When the condition clears, auto-resolving rules close
 * their ACTIVE incidents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertRuleEvaluator {

    private final IncidentManager incidentManager;
    private final NotificationService notificationService;
    private final MeterRegistry meterRegistry;

    private final Map<String, RuleEvaluationState> states = new ConcurrentHashMap<>();

    /**
     * Evaluate every given rule against one sample. A failing rule is logged and skipped.
     *
     * @return number of incidents opened
     */
    public int evaluate(MetricSample sample, List<AlertRule> rules) {
        int opened = 0;
        for (AlertRule rule : rules) {
            try {
                if (evaluateRule(rule, sample.value(), sample.timestamp())) {
                    opened++;
                }
            } catch (Exception e) {
                log.error("Error evaluating alert rule {}: {}", rule.getName(), e.getMessage(), e);
                Counter.builder("hostmonitor.rule.evaluation.errors")
                        .tag("rule", rule.getName())
                        .register(meterRegistry)
                        .increment();
            }
        }
        return opened;
    }

    /**
     * Advance one rule's state machine.
     *
     * @return true if an incident was opened
     */
    public boolean evaluateRule(AlertRule rule, double value, Instant now) {
        RuleEvaluationState state = states.computeIfAbsent(rule.getId(), id -> new RuleEvaluationState());
        String definition = definitionOf(rule);
        if (!definition.equals(state.getDefinition())) {
            if (state.isTriggering()) {
                log.info("Rule {} was redefined, restarting its triggering episode", rule.getName());
            }
            state.reset();
            state.setDefinition(definition);
        }
        boolean triggered = rule.getCondition().test(value, rule.getThreshold());

        if (!triggered) {
            if (state.isTriggering()) {
                if (rule.isAutoResolve()) {
                    int resolved = incidentManager.autoResolve(rule.getId(), now);
                    if (resolved > 0) {
                        log.info("Rule {} recovered ({} = {}), resolved {} incident(s)",
                                rule.getName(), rule.getMetric(), value, resolved);
                    }
                }
                state.reset();
            }
            return false;
        }

        if (!state.isTriggering()) {
            state.setTriggeredAt(now);
            state.setConsecutiveTriggers(1);
        } else {
            state.setConsecutiveTriggers(state.getConsecutiveTriggers() + 1);
        }

        Duration sinceTrigger = Duration.between(state.getTriggeredAt(), now);
        if (sinceTrigger.compareTo(Duration.ofSeconds(rule.getDurationSeconds())) < 0) {
            return false;
        }
        if (state.getLastNotification() != null
                && Duration.between(state.getLastNotification(), now)
                        .compareTo(Duration.ofSeconds(rule.getCooldownSeconds())) < 0) {
            return false;
        }
        if (incidentManager.isSilenced(rule.getId(), state.getTriggeredAt(), now)) {
            log.debug("Rule {} is silenced by an acknowledged or suppressed incident", rule.getName());
            return false;
        }

        Incident incident = incidentManager.create(rule, value, now);
        state.setLastNotification(now);
        Counter.builder("hostmonitor.incidents.created")
                .tag("level", rule.getLevel().name())
                .tag("category", rule.getCategory().name())
                .register(meterRegistry)
                .increment();
        notificationService.dispatch(incident, rule.getNotificationChannels());
        return true;
    }

    private static String definitionOf(AlertRule rule) {
        return rule.getMetric() + " " + rule.getCondition() + " " + rule.getThreshold();
    }

    /**
     * Forget the state of every rule not in {@code ruleIds} (deleted or disabled rules).
     */
    public void retainStates(Set<String> ruleIds) {
        states.keySet().retainAll(ruleIds);
    }

    public Optional<RuleEvaluationState> stateOf(String ruleId) {
        return Optional.ofNullable(states.get(ruleId)).map(RuleEvaluationState::copy);
    }
}
