package com.example.hostmonitor.error;

/**
 * Unknown rule or incident id.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException rule(String id) {
        return new NotFoundException("Alert rule not found: " + id);
    }

    public static NotFoundException incident(String id) {
        return new NotFoundException("Incident not found: " + id);
    }
}
