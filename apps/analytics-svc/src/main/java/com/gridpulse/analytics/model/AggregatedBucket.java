package com.gridpulse.analytics.model;

public record AggregatedBucket(
        String period,
        double totalKwh,
        double averageKwh,
        double minKwh,
        double maxKwh,
        long readingCount
) {
}
