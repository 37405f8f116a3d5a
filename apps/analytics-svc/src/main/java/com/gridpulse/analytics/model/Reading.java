package com.gridpulse.analytics.model;

import java.time.Instant;

/**
 * One timestamped energy measurement for a meter.
 * <p>
 * {@code anomalyScore} and {@code anomalyStatus} are only non-null while {@code anomaly} is true.
 */
public record Reading(
        Long id,
        long meterId,
        Instant timestamp,
        double valueKwh,
        boolean anomaly,
        Double anomalyScore,
        AnomalyStatus anomalyStatus
) {
    public Reading {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must be provided");
        }
        if (!anomaly && (anomalyScore != null || anomalyStatus != null)) {
            throw new IllegalArgumentException("a non-anomalous reading carries no score or status");
        }
    }

    public static Reading of(long meterId, Instant timestamp, double valueKwh) {
        return new Reading(null, meterId, timestamp, valueKwh, false, null, null);
    }

    public Reading withId(Long newId) {
        return new Reading(newId, meterId, timestamp, valueKwh, anomaly, anomalyScore, anomalyStatus);
    }

    public Reading flagged(double score, AnomalyStatus status) {
        return new Reading(id, meterId, timestamp, valueKwh, true, score, status);
    }

    public Reading withStatus(AnomalyStatus status) {
        if (!anomaly) {
            throw new IllegalStateException("reading " + id + " is not flagged as an anomaly");
        }
        return new Reading(id, meterId, timestamp, valueKwh, true, anomalyScore, status);
    }

    public Reading cleared() {
        return new Reading(id, meterId, timestamp, valueKwh, false, null, null);
    }
}
