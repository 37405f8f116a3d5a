package com.gridpulse.analytics.detection;

/**
 * Thresholds handed to every detector call.
 *
 * @param zScoreThreshold        |z| strictly above this flags a reading
 * @param iqrMultiplier          k in {@code [Q1 - k*IQR, Q3 + k*IQR]}
 * @param movingAverageWindow    trailing window size W, current reading included
 * @param movingAverageThreshold |trailing z| strictly above this flags a reading
 */
public record DetectorSettings(
        double zScoreThreshold,
        double iqrMultiplier,
        int movingAverageWindow,
        double movingAverageThreshold
) {
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0d;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5d;
    public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 10;
    public static final double DEFAULT_MOVING_AVERAGE_THRESHOLD = 2.0d;

    public DetectorSettings {
        if (!(zScoreThreshold > 0) || Double.isInfinite(zScoreThreshold)) {
            throw new IllegalArgumentException("zScoreThreshold must be a positive number");
        }
        if (!(iqrMultiplier > 0) || Double.isInfinite(iqrMultiplier)) {
            throw new IllegalArgumentException("iqrMultiplier must be a positive number");
        }
        if (movingAverageWindow < 2) {
            throw new IllegalArgumentException("movingAverageWindow must be at least 2");
        }
        if (!(movingAverageThreshold > 0) || Double.isInfinite(movingAverageThreshold)) {
            throw new IllegalArgumentException("movingAverageThreshold must be a positive number");
        }
        double reachable = maxMovingAverageScore(movingAverageWindow);
        if (movingAverageThreshold >= reachable) {
            throw new IllegalArgumentException(String.format(
                    "movingAverageThreshold %.3f can never be exceeded with a window of %d (max |score| %.3f)",
                    movingAverageThreshold, movingAverageWindow, reachable));
        }
    }

    /**
     * Largest |score| a trailing window of {@code window} readings can produce: the current reading is part of
     * its own window, so one outlier against {@code window - 1} equal readings scores {@code (W-1)/sqrt(W)}.
     */
    public static double maxMovingAverageScore(int window) {
        return (window - 1) / Math.sqrt(window);
    }

    public static DetectorSettings defaults() {
        return new DetectorSettings(
                DEFAULT_Z_SCORE_THRESHOLD,
                DEFAULT_IQR_MULTIPLIER,
                DEFAULT_MOVING_AVERAGE_WINDOW,
                DEFAULT_MOVING_AVERAGE_THRESHOLD
        );
    }

    public DetectorSettings withZScoreThreshold(double threshold) {
        return new DetectorSettings(threshold, iqrMultiplier, movingAverageWindow, movingAverageThreshold);
    }

    public DetectorSettings withIqrMultiplier(double multiplier) {
        return new DetectorSettings(zScoreThreshold, multiplier, movingAverageWindow, movingAverageThreshold);
    }

    public DetectorSettings withMovingAverage(int window, double threshold) {
        return new DetectorSettings(zScoreThreshold, iqrMultiplier, window, threshold);
    }
}
