package com.example.hostmonitor.notification;

import com.example.hostmonitor.alert.IncidentManager;
import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.Incident;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Notification Service - fans an incident out to its rule's channels.
 * <p>
 * Each channel is delivered on the notification executor with its own timeout.
 * Failures are logged and counted, never retried and never propagated to the
 * sampling loop.
 */
@Slf4j
@Service
public class NotificationService {

    private final NotificationDispatcher dispatcher;
    private final IncidentManager incidentManager;
    private final MeterRegistry meterRegistry;
    private final Executor executor;
    private final long timeoutSeconds;

    public NotificationService(NotificationDispatcher dispatcher,
                               IncidentManager incidentManager,
                               MonitorProperties properties,
                               MeterRegistry meterRegistry,
                               @Qualifier("notificationExecutor") Executor executor) {
        this.dispatcher = dispatcher;
        this.incidentManager = incidentManager;
        this.meterRegistry = meterRegistry;
        this.executor = executor;
        this.timeoutSeconds = properties.getNotifications().getTimeoutSeconds();
    }

    /**
     * Submit one delivery per channel and return without waiting.
     *
     * @return completes once every delivery has finished, failed or timed out
     */
    public CompletableFuture<Void> dispatch(Incident incident, Collection<String> channels) {
        if (channels == null || channels.isEmpty()) {
            log.debug("No notification channels for incident {}", incident.getId());
            return CompletableFuture.completedFuture(null);
        }
        log.info("Sending notifications for incident {} (level: {}) to {}",
                incident.getId(), incident.getLevel(), channels);

        CompletableFuture<?>[] deliveries = channels.stream()
                .map(channel -> deliver(incident, channel))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(deliveries);
    }

    private CompletableFuture<DeliveryReceipt> deliver(Incident incident, String channelId) {
        CompletableFuture<DeliveryReceipt> delivery;
        try {
            delivery = CompletableFuture.supplyAsync(() -> dispatcher.deliver(incident, channelId), executor);
        } catch (RejectedExecutionException e) {
            log.error("Notification queue full, dropping delivery of incident {} to {}", incident.getId(), channelId);
            record("rejected");
            return CompletableFuture.completedFuture(null);
        }

        return delivery
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .handle((receipt, error) -> {
                    if (error == null) {
                        incidentManager.recordNotification(incident.getId(), receipt.deliveredAt());
                        log.info("Notification sent for incident {} to {}", incident.getId(), channelId);
                        record("delivered");
                        return receipt;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    if (cause instanceof TimeoutException) {
                        log.error("Notification to {} timed out after {}s for incident {}",
                                channelId, timeoutSeconds, incident.getId());
                        record("timeout");
                    } else {
                        log.error("Failed to send notification to {} for incident {}: {}",
                                channelId, incident.getId(), cause.getMessage());
                        record("failed");
                    }
                    return null;
                });
    }

    private void record(String outcome) {
        Counter.builder("hostmonitor.notifications")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
