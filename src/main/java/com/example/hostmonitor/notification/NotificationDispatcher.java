package com.example.hostmonitor.notification;

import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.error.TransportException;

/**
 * Delivers an incident to one notification channel.
 * Implementations may block; they are only ever called from the notification executor.
 */
public interface NotificationDispatcher {

    /**
     * @throws TransportException if the channel could not be reached
     */
    DeliveryReceipt deliver(Incident incident, String channelId);
}
