package com.example.hostmonitor.notification;

import com.example.hostmonitor.domain.Incident;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Default dispatcher: renders the notification text and writes it to the log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private final Clock clock;

    @Override
    public DeliveryReceipt deliver(Incident incident, String channelId) {
        String text = render(incident);
        switch (incident.getLevel()) {
            case EMERGENCY, CRITICAL -> log.error("[{}] {}", channelId, text);
            case WARNING -> log.warn("[{}] {}", channelId, text);
            case INFO -> log.info("[{}] {}", channelId, text);
        }
        return new DeliveryReceipt(incident.getId(), channelId, Instant.now(clock), "logged");
    }

    static String render(Incident incident) {
        String marker = switch (incident.getLevel()) {
            case EMERGENCY -> "!!!";
            case CRITICAL -> "!!";
            case WARNING -> "!";
            case INFO -> "i";
        };
        return String.format("%s [%s] %s\nCategory: %s\n%s\nID: %s",
                marker, incident.getLevel(), incident.getTitle(),
                incident.getCategory(), incident.getMessage(), incident.getId());
    }
}
