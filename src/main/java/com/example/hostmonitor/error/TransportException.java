package com.example.hostmonitor.error;

/**
 * Notification delivery failed. Logged by the caller, never retried.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
