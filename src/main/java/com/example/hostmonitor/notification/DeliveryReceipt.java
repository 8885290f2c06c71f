package com.example.hostmonitor.notification;

import java.time.Instant;

public record DeliveryReceipt(String incidentId, String channelId, Instant deliveredAt, String detail) {
}
