package com.gridpulse.analytics.model;

public record StatusChange(
        long readingId,
        long meterId,
        AnomalyStatus previousStatus,
        AnomalyStatus newStatus,
        String message
) {
}
