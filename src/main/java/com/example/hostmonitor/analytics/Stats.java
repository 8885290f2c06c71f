package com.example.hostmonitor.analytics;

import java.util.List;

/**
 * Small descriptive-statistics helpers over plain value lists.
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double stddev(List<Double> values) {
        int n = values.size();
        if (n < 2) return 0.0;
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (n - 1));
    }

    /**
     * Least-squares fit over (index, value) pairs, evaluated one step past the last value.
     * Falls back to the mean when the values cannot be fitted.
     */
    public static double predictNext(List<Double> values) {
        int n = values.size();
        if (n < 2) return mean(values);
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int x = 0; x < n; x++) {
            double y = values.get(x);
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += (double) x * x;
        }
        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) return mean(values);
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return slope * n + intercept;
    }
}
