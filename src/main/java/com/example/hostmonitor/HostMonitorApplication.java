package com.example.hostmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Host Monitor - alerting and analytics engine for host resource metrics.
 *
 * Architecture:
 * - Sampling Loop → pulls readings from every registered Sampler once per tick
 * - Time Series Store → bounded retention of raw samples
 * - Baseline Estimator / Anomaly Detector → rolling statistics and deviation feed
 * - Alert Rule Evaluator → per-rule debounce/cooldown state machine
 * - Incident Manager → incident lifecycle, active index and summaries
 * - Snapshot Service → periodic JSON snapshots of rules, incidents and baselines
 */
@SpringBootApplication
@EnableScheduling
public class HostMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostMonitorApplication.class, args);
    }
}
