package com.gridpulse.analytics.detection;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the detectors.
 */
final class WindowStatistics {

    private WindowStatistics() {
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0d;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Sample standard deviation (n - 1 denominator) over {@code values[from, to)}; 0 for fewer than two values.
     */
    static double sampleStdDev(double[] values, int from, int to, double mean) {
        int count = to - from;
        if (count < 2) {
            return 0d;
        }
        double squares = 0d;
        for (int i = from; i < to; i++) {
            double delta = values[i] - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (count - 1));
    }

    /**
     * Percentile by linear interpolation between order statistics: position {@code h = p/100 * (n - 1)}
     * (0-based) over the sorted values, result {@code x[floor h] + (h - floor h) * (x[ceil h] - x[floor h])}.
     */
    static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] + weight * (sortedValues[upper] - sortedValues[lower]);
    }

    static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }
}
