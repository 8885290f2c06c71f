package com.example.hostmonitor.monitoring;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.MetricSample;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodic scheduler that collects readings from every {@link Sampler} and
 * feeds them to the engine. Fixed delay, so a slow tick is never overlapped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SamplingLoop {

    private final List<Sampler> samplers;
    private final MonitoringEngine engine;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${host-monitor.sampling.interval-seconds:30}000",
            initialDelayString = "${host-monitor.sampling.interval-seconds:30}000")
    public void run() {
        if (!properties.getSampling().isEnabled()) return;

        Instant now = Instant.now(clock);
        List<MetricSample> samples = new ArrayList<>();
        for (Sampler sampler : samplers) {
            try {
                samples.addAll(sampler.sample(now));
            } catch (Exception e) {
                log.error("Sampler {} failed: {}", sampler.getName(), e.getMessage());
            }
        }
        if (samples.isEmpty()) return;

        Timer.Sample timer = Timer.start(meterRegistry);
        try {
            engine.tick(samples, now);
        } catch (Exception e) {
            log.error("Monitoring tick failed: {}", e.getMessage(), e);
        } finally {
            timer.stop(Timer.builder("hostmonitor.tick.duration").register(meterRegistry));
        }
    }
}
