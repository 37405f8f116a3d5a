package com.gridpulse.analytics.model;

public record ConsumptionStats(
        long meterId,
        int periodDays,
        double totalKwh,
        double dailyAverageKwh,
        double peakKwh,
        long anomalyCount
) {
}
