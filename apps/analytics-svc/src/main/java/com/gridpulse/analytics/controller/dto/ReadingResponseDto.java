package com.gridpulse.analytics.controller.dto;

import java.time.Instant;

public record ReadingResponseDto(
        long id,
        long meterId,
        Instant timestamp,
        double valueKwh,
        boolean anomaly,
        Double anomalyScore,
        String anomalyStatus
) {
}
