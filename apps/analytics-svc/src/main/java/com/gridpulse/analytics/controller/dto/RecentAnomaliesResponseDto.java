package com.gridpulse.analytics.controller.dto;

import java.time.Instant;
import java.util.List;

public record RecentAnomaliesResponseDto(
        int periodHours,
        int totalAnomalies,
        List<AnomalyDto> anomalies
) {
    public record AnomalyDto(
            long readingId,
            long meterId,
            Instant timestamp,
            double valueKwh,
            Double anomalyScore,
            String status,
            String severity
    ) {
    }
}
