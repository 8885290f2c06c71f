package com.example.hostmonitor.persistence;

import com.example.hostmonitor.alert.AlertRuleService;
import com.example.hostmonitor.alert.IncidentManager;
import com.example.hostmonitor.analytics.BaselineEstimator;
import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.error.PersistenceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Loads state on startup and writes it back whenever it changed.
 * <p>
 * Each store exposes a version counter; a collection is rewritten only when
 * its version moved since the last successful write. A failed write leaves the
 * saved version untouched so the next flush tries again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotService {

    private final SnapshotRepository repository;
    private final AlertRuleService ruleService;
    private final IncidentManager incidentManager;
    private final BaselineEstimator baselineEstimator;
    private final MonitorProperties properties;

    private long savedRulesVersion = -1;
    private long savedIncidentsVersion = -1;
    private long savedBaselinesVersion = -1;

    @PostConstruct
    public void restore() {
        if (properties.getPersistence().isEnabled()) {
            try {
                ruleService.restore(repository.loadRules().values());
                incidentManager.restore(repository.loadIncidents().values());
                baselineEstimator.restore(repository.loadBaselines().values());
            } catch (PersistenceException e) {
                log.error("Could not restore snapshot from {}: {}", repository.getDataDir(), e.getMessage());
            }
            savedRulesVersion = ruleService.version();
            savedIncidentsVersion = incidentManager.version();
            savedBaselinesVersion = baselineEstimator.version();
        }

        if (properties.getRules().isInstallDefaults() && ruleService.count() == 0) {
            ruleService.installDefaults();
        }
    }

    @Scheduled(fixedDelayString = "${host-monitor.persistence.snapshot-interval-seconds:60}000")
    public void scheduledFlush() {
        flush();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing snapshot before shutdown");
        flush();
    }

    /**
     * Write every collection whose version changed since its last successful write.
     *
     * @return true if nothing is left unsaved
     */
    public synchronized boolean flush() {
        if (!properties.getPersistence().isEnabled()) return true;

        boolean clean = true;
        long rulesVersion = ruleService.version();
        if (rulesVersion != savedRulesVersion) {
            try {
                repository.saveRules(ruleService.snapshot());
                savedRulesVersion = rulesVersion;
            } catch (PersistenceException e) {
                log.error("Rule snapshot failed, will retry: {}", e.getMessage());
                clean = false;
            }
        }

        long incidentsVersion = incidentManager.version();
        if (incidentsVersion != savedIncidentsVersion) {
            try {
                repository.saveIncidents(incidentManager.snapshot());
                savedIncidentsVersion = incidentsVersion;
            } catch (PersistenceException e) {
                log.error("Incident snapshot failed, will retry: {}", e.getMessage());
                clean = false;
            }
        }

        long baselinesVersion = baselineEstimator.version();
        if (baselinesVersion != savedBaselinesVersion) {
            try {
                repository.saveBaselines(baselineEstimator.all());
                savedBaselinesVersion = baselinesVersion;
            } catch (PersistenceException e) {
                log.error("Baseline snapshot failed, will retry: {}", e.getMessage());
                clean = false;
            }
        }
        return clean;
    }
}
