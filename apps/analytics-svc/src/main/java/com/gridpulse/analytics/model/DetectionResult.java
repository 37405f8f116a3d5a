package com.gridpulse.analytics.model;

/**
 * Derived fields written back for one reading by a detection run.
 */
public record DetectionResult(long readingId, boolean anomaly, Double score, AnomalyStatus status) {

    public static DetectionResult flagged(long readingId, double score, AnomalyStatus status) {
        return new DetectionResult(readingId, true, score, status);
    }

    public static DetectionResult clear(long readingId) {
        return new DetectionResult(readingId, false, null, null);
    }

    public Reading applyTo(Reading reading) {
        return anomaly ? reading.flagged(score, status) : reading.cleared();
    }
}
