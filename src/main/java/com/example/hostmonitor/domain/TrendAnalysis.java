package com.example.hostmonitor.domain;

public record TrendAnalysis(
        String metricName,
        Direction direction,
        double changePercent,
        double average,
        double min,
        double max,
        double standardDeviation,
        double predictedNext,
        int sampleCount) {

    public enum Direction {
        RISING, FALLING, STABLE
    }
}
