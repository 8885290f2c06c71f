package com.example.hostmonitor.monitoring;

import com.example.hostmonitor.domain.MetricSample;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushSamplerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private static MetricSample cpu(double value) {
        return new MetricSample("cpu_percent", value, NOW);
    }

    @Test
    void batchThatDoesNotFitIsRefusedWhole() {
        PushSampler sampler = new PushSampler(3);

        assertTrue(sampler.push(List.of(cpu(1), cpu(2))));
        assertFalse(sampler.push(List.of(cpu(3), cpu(4))));
        assertEquals(2, sampler.pending());

        assertTrue(sampler.push(List.of(cpu(3))));
        assertFalse(sampler.push(List.of(cpu(4))));
        assertEquals(3, sampler.pending());
    }

    @Test
    void drainingFreesCapacity() {
        PushSampler sampler = new PushSampler(2);
        sampler.push(List.of(cpu(1), cpu(2)));

        List<MetricSample> drained = sampler.sample(NOW);

        assertEquals(List.of(1.0, 2.0), drained.stream().map(MetricSample::value).toList());
        assertEquals(0, sampler.pending());
        assertTrue(sampler.push(List.of(cpu(3), cpu(4))));
    }
}
