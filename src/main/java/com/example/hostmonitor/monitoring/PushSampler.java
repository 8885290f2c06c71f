package com.example.hostmonitor.monitoring;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Buffers samples pushed over HTTP until the next sampling tick drains them.
 * The buffer is bounded; a batch that does not fit is refused as a whole.
 */
@Slf4j
@Component
public class PushSampler implements Sampler {

    private final int capacity;
    private final LinkedBlockingQueue<MetricSample> buffer;

    @Autowired
    public PushSampler(MonitorProperties properties) {
        this(properties.getSampling().getMaxPendingPushSamples());
    }

    public PushSampler(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.buffer = new LinkedBlockingQueue<>(this.capacity);
    }

    /**
     * @return false if the batch would overflow the buffer; nothing is queued then
     */
    public synchronized boolean push(Collection<MetricSample> samples) {
        if (buffer.remainingCapacity() < samples.size()) {
            log.warn("Push buffer full ({} pending, capacity {}), refusing {} samples",
                    buffer.size(), capacity, samples.size());
            return false;
        }
        buffer.addAll(samples);
        log.debug("Buffered {} pushed samples ({} pending)", samples.size(), buffer.size());
        return true;
    }

    public int pending() {
        return buffer.size();
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String getName() {
        return "push";
    }

    @Override
    public List<MetricSample> sample(Instant now) {
        List<MetricSample> drained = new ArrayList<>();
        buffer.drainTo(drained);
        return drained;
    }
}
