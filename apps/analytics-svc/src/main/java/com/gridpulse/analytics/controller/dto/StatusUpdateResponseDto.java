package com.gridpulse.analytics.controller.dto;

public record StatusUpdateResponseDto(
        long readingId,
        long meterId,
        String previousStatus,
        String newStatus,
        String message
) {
}
