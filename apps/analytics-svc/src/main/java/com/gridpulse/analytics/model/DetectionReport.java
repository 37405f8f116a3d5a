package com.gridpulse.analytics.model;

public record DetectionReport(
        long meterId,
        DetectionMethod method,
        int windowSize,
        int anomaliesDetected,
        boolean insufficientData,
        String message
) {
}
