package com.gridpulse.analytics.controller;

import com.gridpulse.analytics.analytics.AggregationService;
import com.gridpulse.analytics.controller.dto.AggregatedConsumptionDto;
import com.gridpulse.analytics.controller.dto.ConsumptionStatsResponseDto;
import com.gridpulse.analytics.controller.dto.ReadingCreateRequestDto;
import com.gridpulse.analytics.controller.dto.ReadingResponseDto;
import com.gridpulse.analytics.model.AggregatedBucket;
import com.gridpulse.analytics.model.BucketSize;
import com.gridpulse.analytics.model.ConsumptionStats;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.service.ReadingService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/consumption")
public class ConsumptionController {

    private final AggregationService aggregationService;
    private final ReadingService readingService;

    public ConsumptionController(AggregationService aggregationService, ReadingService readingService) {
        this.aggregationService = aggregationService;
        this.readingService = readingService;
    }

    @GetMapping("/aggregated/hourly")
    public ResponseEntity<List<AggregatedConsumptionDto>> hourly(
            @RequestParam("meterId") long meterId,
            @RequestParam(value = "days", required = false, defaultValue = "7") int days
    ) {
        return ResponseEntity.ok(map(aggregationService.aggregate(meterId, BucketSize.HOUR, days)));
    }

    @GetMapping("/aggregated/daily")
    public ResponseEntity<List<AggregatedConsumptionDto>> daily(
            @RequestParam("meterId") long meterId,
            @RequestParam(value = "days", required = false, defaultValue = "30") int days
    ) {
        return ResponseEntity.ok(map(aggregationService.aggregate(meterId, BucketSize.DAY, days)));
    }

    @GetMapping("/stats/{meterId}")
    public ResponseEntity<ConsumptionStatsResponseDto> stats(
            @PathVariable("meterId") long meterId,
            @RequestParam(value = "days", required = false, defaultValue = "7") int days
    ) {
        ConsumptionStats stats = aggregationService.consumptionStats(meterId, days);
        return ResponseEntity.ok(new ConsumptionStatsResponseDto(
                stats.meterId(),
                stats.periodDays(),
                stats.totalKwh(),
                stats.dailyAverageKwh(),
                stats.peakKwh(),
                stats.anomalyCount()
        ));
    }

    @PostMapping("/readings")
    public ResponseEntity<ReadingResponseDto> record(@Valid @RequestBody ReadingCreateRequestDto request) {
        Reading saved = readingService.record(request.meterId(), request.timestamp(), request.valueKwh());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(saved));
    }

    @GetMapping("/readings")
    public ResponseEntity<List<ReadingResponseDto>> list(
            @RequestParam(value = "meterId", required = false) Long meterId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "onlyAnomalies", required = false, defaultValue = "false") boolean onlyAnomalies,
            @RequestParam(value = "limit", required = false, defaultValue = "100") int limit
    ) {
        List<Reading> readings = readingService.list(
                Optional.ofNullable(meterId), Optional.ofNullable(from), Optional.ofNullable(to), onlyAnomalies, limit);
        return ResponseEntity.ok(readings.stream().map(this::map).toList());
    }

    private List<AggregatedConsumptionDto> map(List<AggregatedBucket> buckets) {
        return buckets.stream()
                .map(bucket -> new AggregatedConsumptionDto(
                        bucket.period(),
                        bucket.totalKwh(),
                        bucket.averageKwh(),
                        bucket.minKwh(),
                        bucket.maxKwh(),
                        bucket.readingCount()
                ))
                .toList();
    }

    private ReadingResponseDto map(Reading reading) {
        return new ReadingResponseDto(
                reading.id(),
                reading.meterId(),
                reading.timestamp(),
                reading.valueKwh(),
                reading.anomaly(),
                reading.anomalyScore(),
                reading.anomalyStatus() != null ? reading.anomalyStatus().value() : null
        );
    }
}
