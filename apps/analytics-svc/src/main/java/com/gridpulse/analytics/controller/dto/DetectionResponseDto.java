package com.gridpulse.analytics.controller.dto;

public record DetectionResponseDto(
        long meterId,
        String method,
        String window,
        int windowSize,
        int anomaliesDetected,
        boolean insufficientData,
        String message
) {
}
