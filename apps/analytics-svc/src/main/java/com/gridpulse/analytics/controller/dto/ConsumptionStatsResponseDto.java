package com.gridpulse.analytics.controller.dto;

public record ConsumptionStatsResponseDto(
        long meterId,
        int periodDays,
        double totalKwh,
        double dailyAverageKwh,
        double peakKwh,
        long anomalyCount
) {
}
