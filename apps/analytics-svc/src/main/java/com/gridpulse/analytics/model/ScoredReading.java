package com.gridpulse.analytics.model;

public record ScoredReading(Reading reading, boolean anomaly, double score) {
}
