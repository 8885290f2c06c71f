package com.example.hostmonitor.monitoring;

/**
 * Outcome of one {@link MonitoringEngine#tick} call.
 *
 * @param dropped samples rejected by the store: out of order, or dated too far ahead of the tick
 */
public record TickResult(int appended, int dropped, int baselinesUpdated, int anomalies, int incidentsOpened) {
}
