package com.gridpulse.analytics.controller.dto;

public record AnomalySummaryResponseDto(
        long meterId,
        int periodDays,
        long totalReadings,
        long anomalyCount,
        double anomalyRate
) {
}
