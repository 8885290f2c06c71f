package com.example.hostmonitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the host monitor.
 * Maps to the 'host-monitor' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "host-monitor")
public class MonitorProperties {

    private SamplingConfig sampling = new SamplingConfig();
    private RetentionConfig retention = new RetentionConfig();
    private BaselineConfig baseline = new BaselineConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private PersistenceConfig persistence = new PersistenceConfig();
    private RulesConfig rules = new RulesConfig();

    @Data
    public static class SamplingConfig {
        private boolean enabled = true;
        private int intervalSeconds = 30;
        /** Samples dated further ahead of the local clock are rejected */
        private int maxFutureSkewSeconds = 300;
        /** Pushed samples waiting for the next tick; pushes beyond this are refused */
        private int maxPendingPushSamples = 10_000;
    }

    @Data
    public static class RetentionConfig {
        private int sampleDays = 30;
        private int anomalyDays = 7;
        /** Raw samples are pruned once every this many appends */
        private int pruneEveryAppends = 100;
    }

    @Data
    public static class BaselineConfig {
        private int windowDays = 7;
        private int refreshIntervalHours = 24;
        private int minSamples = 24;
    }

    @Data
    public static class NotificationConfig {
        private int timeoutSeconds = 5;
    }

    @Data
    public static class PersistenceConfig {
        private boolean enabled = true;
        private String dataDir = "./data";
        private int snapshotIntervalSeconds = 60;
    }

    @Data
    public static class RulesConfig {
        private boolean installDefaults = true;
    }
}
