package com.example.hostmonitor;

import com.example.hostmonitor.alert.AlertRuleService;
import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.monitoring.MonitoringEngine;
import com.example.hostmonitor.monitoring.Sampler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class HostMonitorApplicationTests {

    @Autowired
    private MonitorProperties monitorProperties;

    @Autowired
    private AlertRuleService ruleService;

    @Autowired
    private MonitoringEngine engine;

    @Autowired
    private List<Sampler> samplers;

    @Test
    void contextLoads() {
        assertNotNull(monitorProperties);
        assertNotNull(ruleService);
        assertNotNull(engine);
    }

    @Test
    void defaultRulesAreInstalled() {
        assertTrue(ruleService.count() >= 4, "Default rules should be installed on startup");
    }

    @Test
    void pushSamplerIsRegistered() {
        assertTrue(samplers.stream().anyMatch(s -> s.getName().equals("push")));
    }

    @Test
    void configurationIsLoaded() {
        assertFalse(monitorProperties.getSampling().isEnabled());
        assertFalse(monitorProperties.getPersistence().isEnabled());
        assertEquals(24, monitorProperties.getBaseline().getMinSamples());
    }
}
