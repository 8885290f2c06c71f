package com.example.hostmonitor.monitoring;

import com.example.hostmonitor.alert.AlertRuleEvaluator;
import com.example.hostmonitor.alert.AlertRuleService;
import com.example.hostmonitor.analytics.AnomalyDetector;
import com.example.hostmonitor.analytics.BaselineEstimator;
import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.MetricSample;
import com.example.hostmonitor.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Monitoring Engine - the per-tick pipeline.
 * <p>
 * Samples are stored first, then baselines are refreshed if due, then every
 * stored sample is checked for anomalies and run through the enabled rules for
 * its metric. Ticks are serialized; the engine is the single writer of the
 * store, the baselines and the rule evaluation state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringEngine {

    private final TimeSeriesStore store;
    private final BaselineEstimator baselineEstimator;
    private final AnomalyDetector anomalyDetector;
    private final AlertRuleService ruleService;
    private final AlertRuleEvaluator evaluator;

    public synchronized TickResult tick(List<MetricSample> samples, Instant now) {
        List<MetricSample> accepted = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            if (store.append(sample, now)) {
                accepted.add(sample);
            }
        }

        int baselinesUpdated = 0;
        try {
            baselinesUpdated = baselineEstimator.refreshIfDue(now);
        } catch (RuntimeException e) {
            log.error("Baseline refresh failed: {}", e.getMessage(), e);
        }

        evaluator.retainStates(ruleService.enabledRuleIds());

        int anomalies = 0;
        int incidentsOpened = 0;
        for (MetricSample sample : accepted) {
            try {
                if (anomalyDetector.detect(sample).isPresent()) {
                    anomalies++;
                }
                List<AlertRule> rules = ruleService.enabledRulesFor(sample.metricName());
                if (!rules.isEmpty()) {
                    incidentsOpened += evaluator.evaluate(sample, rules);
                }
            } catch (RuntimeException e) {
                log.error("Processing failed for metric {}: {}", sample.metricName(), e.getMessage(), e);
            }
        }

        anomalyDetector.prune(now);

        TickResult result = new TickResult(accepted.size(), samples.size() - accepted.size(),
                baselinesUpdated, anomalies, incidentsOpened);
        if (result.anomalies() > 0 || result.incidentsOpened() > 0) {
            log.info("Tick processed: {}", result);
        } else {
            log.debug("Tick processed: {}", result);
        }
        return result;
    }
}
