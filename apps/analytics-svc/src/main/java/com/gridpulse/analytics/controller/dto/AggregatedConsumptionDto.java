package com.gridpulse.analytics.controller.dto;

public record AggregatedConsumptionDto(
        String period,
        double totalKwh,
        double averageKwh,
        double minKwh,
        double maxKwh,
        long readingCount
) {
}
