package com.example.hostmonitor.monitoring;

import com.example.hostmonitor.domain.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Source of metric readings, polled once per sampling tick.
 */
public interface Sampler {

    String getName();

    List<MetricSample> sample(Instant now);
}
