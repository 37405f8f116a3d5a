package com.gridpulse.analytics.model;

public record AnomalySummary(
        long meterId,
        int periodDays,
        long totalReadings,
        long anomalyCount,
        double anomalyRate
) {
    public static AnomalySummary of(long meterId, int periodDays, long totalReadings, long anomalyCount) {
        double rate = totalReadings == 0 ? 0d : (double) anomalyCount / totalReadings;
        return new AnomalySummary(meterId, periodDays, totalReadings, anomalyCount, rate);
    }
}
