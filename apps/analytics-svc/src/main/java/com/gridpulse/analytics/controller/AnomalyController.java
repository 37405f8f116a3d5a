package com.gridpulse.analytics.controller;

import com.gridpulse.analytics.analytics.AggregationService;
import com.gridpulse.analytics.config.GridpulseProperties;
import com.gridpulse.analytics.controller.dto.AnomalySummaryResponseDto;
import com.gridpulse.analytics.controller.dto.DetectionResponseDto;
import com.gridpulse.analytics.controller.dto.RecentAnomaliesResponseDto;
import com.gridpulse.analytics.controller.dto.StatusUpdateRequestDto;
import com.gridpulse.analytics.controller.dto.StatusUpdateResponseDto;
import com.gridpulse.analytics.detection.AnomalyDetectionService;
import com.gridpulse.analytics.lifecycle.AnomalyStatusService;
import com.gridpulse.analytics.model.AnomalySummary;
import com.gridpulse.analytics.model.DetectionReport;
import com.gridpulse.analytics.model.RecentAnomaly;
import com.gridpulse.analytics.model.StatusChange;
import com.gridpulse.analytics.model.WindowSpec;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analytics/anomalies")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final AnomalyStatusService statusService;
    private final AggregationService aggregationService;
    private final int defaultLookbackDays;

    public AnomalyController(
            AnomalyDetectionService detectionService,
            AnomalyStatusService statusService,
            AggregationService aggregationService,
            GridpulseProperties properties
    ) {
        this.detectionService = detectionService;
        this.statusService = statusService;
        this.aggregationService = aggregationService;
        this.defaultLookbackDays = properties.detection().defaultLookbackDays();
    }

    @PostMapping("/detect/{meterId}")
    public ResponseEntity<DetectionResponseDto> detect(
            @PathVariable("meterId") long meterId,
            @RequestParam(value = "method", required = false, defaultValue = "zscore") String method,
            @RequestParam(value = "days", required = false) Integer days,
            @RequestParam(value = "hours", required = false) Integer hours,
            @RequestParam(value = "all", required = false, defaultValue = "false") boolean all
    ) {
        WindowSpec window = resolveWindow(days, hours, all);
        DetectionReport report = detectionService.runDetection(meterId, method, window);
        return ResponseEntity.ok(new DetectionResponseDto(
                report.meterId(),
                report.method().value(),
                window.describe(),
                report.windowSize(),
                report.anomaliesDetected(),
                report.insufficientData(),
                report.message()
        ));
    }

    @GetMapping("/summary/{meterId}")
    public ResponseEntity<AnomalySummaryResponseDto> summary(
            @PathVariable("meterId") long meterId,
            @RequestParam(value = "days", required = false, defaultValue = "7") int days
    ) {
        AnomalySummary summary = aggregationService.summarize(meterId, days);
        return ResponseEntity.ok(new AnomalySummaryResponseDto(
                summary.meterId(),
                summary.periodDays(),
                summary.totalReadings(),
                summary.anomalyCount(),
                summary.anomalyRate()
        ));
    }

    @GetMapping("/recent")
    public ResponseEntity<RecentAnomaliesResponseDto> recent(
            @RequestParam(value = "hours", required = false, defaultValue = "24") int hours,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit
    ) {
        List<RecentAnomaly> anomalies = aggregationService.recentAnomalies(hours, limit);
        List<RecentAnomaliesResponseDto.AnomalyDto> items = anomalies.stream()
                .map(anomaly -> new RecentAnomaliesResponseDto.AnomalyDto(
                        anomaly.reading().id(),
                        anomaly.reading().meterId(),
                        anomaly.reading().timestamp(),
                        anomaly.reading().valueKwh(),
                        anomaly.reading().anomalyScore(),
                        anomaly.reading().anomalyStatus() != null ? anomaly.reading().anomalyStatus().value() : null,
                        anomaly.severity().value()
                ))
                .toList();
        return ResponseEntity.ok(new RecentAnomaliesResponseDto(hours, items.size(), items));
    }

    @DeleteMapping("/reset/{meterId}")
    public ResponseEntity<Void> reset(@PathVariable("meterId") long meterId) {
        detectionService.resetAnomalies(meterId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{readingId}/status")
    public ResponseEntity<StatusUpdateResponseDto> updateStatus(
            @PathVariable("readingId") long readingId,
            @Valid @RequestBody StatusUpdateRequestDto request
    ) {
        StatusChange change = statusService.setStatus(readingId, request.status());
        return ResponseEntity.ok(new StatusUpdateResponseDto(
                change.readingId(),
                change.meterId(),
                change.previousStatus().value(),
                change.newStatus().value(),
                change.message()
        ));
    }

    private WindowSpec resolveWindow(Integer days, Integer hours, boolean all) {
        int selected = (days != null ? 1 : 0) + (hours != null ? 1 : 0) + (all ? 1 : 0);
        if (selected > 1) {
            throw new IllegalArgumentException("Use only one of days, hours or all");
        }
        if (all) {
            return WindowSpec.all();
        }
        if (hours != null) {
            return WindowSpec.lastHours(hours);
        }
        return WindowSpec.lastDays(days != null ? days : defaultLookbackDays);
    }
}
