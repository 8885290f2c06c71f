package com.example.hostmonitor.alert;

import lombok.Data;

import java.time.Instant;

/**
 * Transient per-rule evaluation state. Not persisted: every rule starts idle after a restart.
 */
@Data
public class RuleEvaluationState {

    /** First sample of the current triggering episode, null while idle */
    private Instant triggeredAt;
    private int consecutiveTriggers;
    private Instant lastNotification;
    /** Metric, condition and threshold the episode was started under */
    private String definition;

    public boolean isTriggering() {
        return triggeredAt != null;
    }

    void reset() {
        triggeredAt = null;
        consecutiveTriggers = 0;
    }

    RuleEvaluationState copy() {
        RuleEvaluationState copy = new RuleEvaluationState();
        copy.setTriggeredAt(triggeredAt);
        copy.setConsecutiveTriggers(consecutiveTriggers);
        copy.setLastNotification(lastNotification);
        copy.setDefinition(definition);
        return copy;
    }
}
