package com.example.hostmonitor.error;

/**
 * Snapshot read or write failed. State stays in memory and the write is retried on the next flush.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
