package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Maps the magnitude of an anomaly score to a display tier. Lower bounds are inclusive.
 */
@Component
public class SeverityClassifier {

    public static final double CRITICAL_THRESHOLD = 5.0d;
    public static final double HIGH_THRESHOLD = 4.0d;

    public Severity classify(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number");
        }
        double magnitude = Math.abs(score);
        if (magnitude >= CRITICAL_THRESHOLD) {
            return Severity.CRITICAL;
        }
        if (magnitude >= HIGH_THRESHOLD) {
            return Severity.HIGH;
        }
        return Severity.MODERATE;
    }

    public Severity classify(Double score) {
        return score == null ? Severity.MODERATE : classify(score.doubleValue());
    }
}
