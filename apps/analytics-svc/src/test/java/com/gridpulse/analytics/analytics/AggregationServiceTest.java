package com.gridpulse.analytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.gridpulse.analytics.detection.SeverityClassifier;
import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.AggregatedBucket;
import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.AnomalySummary;
import com.gridpulse.analytics.model.BucketSize;
import com.gridpulse.analytics.model.ConsumptionStats;
import com.gridpulse.analytics.model.Meter;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.RecentAnomaly;
import com.gridpulse.analytics.model.Severity;
import com.gridpulse.analytics.repository.InMemoryMeterRepository;
import com.gridpulse.analytics.repository.InMemoryReadingRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AggregationServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-16T12:00:00Z");

    private InMemoryReadingRepository readings;
    private AggregationService service;
    private long meterId;
    private long otherMeterId;

    @BeforeEach
    void setUp() {
        readings = new InMemoryReadingRepository();
        InMemoryMeterRepository meters = new InMemoryMeterRepository();
        meterId = meters.save(new Meter(null, 1L, "MTR-A", "electric", true)).id();
        otherMeterId = meters.save(new Meter(null, 1L, "MTR-B", "electric", true)).id();
        service = new AggregationService(readings, meters, new SeverityClassifier(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void hourlyBucketsAreAscendingAndSkipGaps() {
        save(meterId, "2024-01-15T10:15:00Z", 2.0);
        save(meterId, "2024-01-15T10:45:00Z", 4.0);
        save(meterId, "2024-01-15T13:05:00Z", 1.0);
        save(meterId, "2024-01-15T09:59:59Z", 3.0);
        save(otherMeterId, "2024-01-15T10:30:00Z", 100.0);

        List<AggregatedBucket> buckets = service.aggregate(meterId, BucketSize.HOUR, 7);

        assertThat(buckets).extracting(AggregatedBucket::period)
                .containsExactly("2024-01-15T09:00:00Z", "2024-01-15T10:00:00Z", "2024-01-15T13:00:00Z");
        AggregatedBucket tenOClock = buckets.get(1);
        assertThat(tenOClock.totalKwh()).isEqualTo(6.0);
        assertThat(tenOClock.averageKwh()).isEqualTo(3.0);
        assertThat(tenOClock.minKwh()).isEqualTo(2.0);
        assertThat(tenOClock.maxKwh()).isEqualTo(4.0);
        assertThat(tenOClock.readingCount()).isEqualTo(2);
    }

    @Test
    void dailyBucketsUseUtcDates() {
        save(meterId, "2024-01-14T23:59:00Z", 1.0);
        save(meterId, "2024-01-15T00:00:00Z", 2.0);
        save(meterId, "2024-01-15T18:00:00Z", 3.0);

        List<AggregatedBucket> buckets = service.aggregate(meterId, BucketSize.DAY, 30);

        assertThat(buckets).extracting(AggregatedBucket::period).containsExactly("2024-01-14", "2024-01-15");
        assertThat(buckets).extracting(AggregatedBucket::readingCount).containsExactly(1L, 2L);
        assertThat(buckets).allSatisfy(bucket -> assertThat(bucket.averageKwh())
                .isBetween(bucket.minKwh(), bucket.maxKwh()));
    }

    @Test
    void readingsBeforeRangeAreExcluded() {
        save(meterId, "2024-01-01T10:00:00Z", 9.0);

        assertThat(service.aggregate(meterId, BucketSize.HOUR, 1)).isEmpty();
    }

    @Test
    void aggregationRangeIsValidated() {
        assertThatThrownBy(() -> service.aggregate(meterId, BucketSize.HOUR, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.aggregate(meterId, BucketSize.HOUR, 91))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 90");
        assertThat(service.aggregate(meterId, BucketSize.DAY, 365)).isEmpty();
        assertThatThrownBy(() -> service.aggregate(999L, BucketSize.DAY, 7))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void summaryCountsAnomalies() {
        save(meterId, "2024-01-15T10:00:00Z", 1.0);
        save(meterId, "2024-01-15T11:00:00Z", 1.0);
        save(meterId, "2024-01-15T12:00:00Z", 1.0);
        readings.save(Reading.of(meterId, Instant.parse("2024-01-15T13:00:00Z"), 9.0).flagged(3.4, AnomalyStatus.PENDING));

        AnomalySummary summary = service.summarize(meterId, 7);

        assertThat(summary.totalReadings()).isEqualTo(4);
        assertThat(summary.anomalyCount()).isEqualTo(1);
        assertThat(summary.anomalyRate()).isEqualTo(0.25);
    }

    @Test
    void summaryOfEmptyRangeHasZeroRate() {
        AnomalySummary summary = service.summarize(meterId, 7);

        assertThat(summary.totalReadings()).isZero();
        assertThat(summary.anomalyRate()).isZero();
    }

    @Test
    void recentAnomaliesAreNewestFirstAcrossMeters() {
        flag(meterId, "2024-01-16T08:00:00Z", 3.2);
        flag(otherMeterId, "2024-01-16T10:00:00Z", -5.5);
        flag(meterId, "2024-01-16T09:00:00Z", 4.1);
        flag(meterId, "2024-01-14T09:00:00Z", 9.0);

        List<RecentAnomaly> recent = service.recentAnomalies(24, 50);

        assertThat(recent).extracting(anomaly -> anomaly.reading().timestamp())
                .containsExactly(
                        Instant.parse("2024-01-16T10:00:00Z"),
                        Instant.parse("2024-01-16T09:00:00Z"),
                        Instant.parse("2024-01-16T08:00:00Z"));
        assertThat(recent).extracting(RecentAnomaly::severity)
                .containsExactly(Severity.CRITICAL, Severity.HIGH, Severity.MODERATE);
    }

    @Test
    void recentAnomaliesKeepTheNewestWithinLimit() {
        flag(meterId, "2024-01-16T07:00:00Z", 3.2);
        flag(otherMeterId, "2024-01-16T11:00:00Z", 3.2);
        flag(meterId, "2024-01-16T09:00:00Z", 3.2);
        flag(meterId, "2024-01-16T11:30:00Z", 3.2);
        flag(otherMeterId, "2024-01-15T13:00:00Z", 3.2);
        flag(meterId, "2024-01-15T11:59:59Z", 3.2);

        List<RecentAnomaly> recent = service.recentAnomalies(24, 2);

        assertThat(recent).extracting(anomaly -> anomaly.reading().timestamp())
                .containsExactly(Instant.parse("2024-01-16T11:30:00Z"), Instant.parse("2024-01-16T11:00:00Z"));
        assertThat(service.recentAnomalies(24, 50)).hasSize(5);
    }

    @Test
    void recentAnomaliesRangeIsValidated() {
        assertThatThrownBy(() -> service.recentAnomalies(169, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recentAnomalies(24, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recentAnomalies(24, 501)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void consumptionStatsOverPeriod() {
        save(meterId, "2024-01-15T10:00:00Z", 6.0);
        save(meterId, "2024-01-15T11:00:00Z", 8.0);
        readings.save(Reading.of(meterId, Instant.parse("2024-01-15T12:00:00Z"), 14.0).flagged(2.1, AnomalyStatus.IGNORED));

        ConsumptionStats stats = service.consumptionStats(meterId, 7);

        assertThat(stats.totalKwh()).isEqualTo(28.0);
        assertThat(stats.dailyAverageKwh()).isCloseTo(4.0, within(1e-9));
        assertThat(stats.peakKwh()).isEqualTo(14.0);
        assertThat(stats.anomalyCount()).isEqualTo(1);
    }

    @Test
    void consumptionStatsOfEmptyMeterAreZero() {
        ConsumptionStats stats = service.consumptionStats(meterId, 7);

        assertThat(stats.totalKwh()).isZero();
        assertThat(stats.peakKwh()).isZero();
    }

    private void save(long meter, String timestamp, double value) {
        readings.save(Reading.of(meter, Instant.parse(timestamp), value));
    }

    private void flag(long meter, String timestamp, double score) {
        readings.save(Reading.of(meter, Instant.parse(timestamp), 50.0).flagged(score, AnomalyStatus.PENDING));
    }
}
