package com.gridpulse.analytics.analytics;

import com.gridpulse.analytics.detection.SeverityClassifier;
import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.AggregatedBucket;
import com.gridpulse.analytics.model.AnomalySummary;
import com.gridpulse.analytics.model.BucketSize;
import com.gridpulse.analytics.model.ConsumptionStats;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.RecentAnomaly;
import com.gridpulse.analytics.repository.MeterRepository;
import com.gridpulse.analytics.repository.ReadingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Read-side rollups over the reading store. Buckets are UTC calendar hours or days; every range ends at "now".
 */
@Service
public class AggregationService {

    public static final int MAX_SUMMARY_DAYS = 365;
    public static final int MAX_RECENT_HOURS = 168;
    public static final int MAX_RECENT_LIMIT = 500;

    private final ReadingRepository readingRepository;
    private final MeterRepository meterRepository;
    private final SeverityClassifier severityClassifier;
    private final Clock clock;

    @Autowired
    public AggregationService(
            ReadingRepository readingRepository,
            MeterRepository meterRepository,
            SeverityClassifier severityClassifier,
            Clock clock
    ) {
        this.readingRepository = readingRepository;
        this.meterRepository = meterRepository;
        this.severityClassifier = severityClassifier;
        this.clock = clock;
    }

    /**
     * One bucket per calendar hour or day holding at least one reading, ascending. Empty buckets are omitted.
     */
    public List<AggregatedBucket> aggregate(long meterId, BucketSize bucketSize, int daysBack) {
        if (bucketSize == null) {
            throw new IllegalArgumentException("bucket size must be provided");
        }
        requireInRange("days", daysBack, bucketSize.maxDaysBack());
        requireMeter(meterId);
        Instant now = clock.instant();
        List<Reading> readings = readingRepository.queryRange(Optional.of(meterId), now.minus(Duration.ofDays(daysBack)), now);

        Map<Instant, DoubleSummaryStatistics> buckets = new TreeMap<>();
        for (Reading reading : readings) {
            Instant bucketStart = reading.timestamp().truncatedTo(bucketSize.unit());
            buckets.computeIfAbsent(bucketStart, key -> new DoubleSummaryStatistics()).accept(reading.valueKwh());
        }
        return buckets.entrySet().stream()
                .map(entry -> toBucket(periodLabel(entry.getKey(), bucketSize), entry.getValue()))
                .toList();
    }

    public AnomalySummary summarize(long meterId, int daysBack) {
        requireInRange("days", daysBack, MAX_SUMMARY_DAYS);
        requireMeter(meterId);
        Instant now = clock.instant();
        List<Reading> readings = readingRepository.queryRange(Optional.of(meterId), now.minus(Duration.ofDays(daysBack)), now);
        long anomalies = readings.stream().filter(Reading::anomaly).count();
        return AnomalySummary.of(meterId, daysBack, readings.size(), anomalies);
    }

    /**
     * Flagged readings of all meters from the last {@code hoursBack} hours, newest first, at most {@code limit}.
     */
    public List<RecentAnomaly> recentAnomalies(int hoursBack, int limit) {
        requireInRange("hours", hoursBack, MAX_RECENT_HOURS);
        requireInRange("limit", limit, MAX_RECENT_LIMIT);
        Instant now = clock.instant();
        return readingRepository.findAnomalies(now.minus(Duration.ofHours(hoursBack)), now, limit).stream()
                .map(reading -> new RecentAnomaly(reading, severityClassifier.classify(reading.anomalyScore())))
                .toList();
    }

    public ConsumptionStats consumptionStats(long meterId, int days) {
        requireInRange("days", days, MAX_SUMMARY_DAYS);
        requireMeter(meterId);
        Instant now = clock.instant();
        List<Reading> readings = readingRepository.queryRange(Optional.of(meterId), now.minus(Duration.ofDays(days)), now);
        DoubleSummaryStatistics stats = readings.stream().mapToDouble(Reading::valueKwh).summaryStatistics();
        double total = stats.getSum();
        double peak = stats.getCount() == 0 ? 0d : stats.getMax();
        long anomalies = readings.stream().filter(Reading::anomaly).count();
        return new ConsumptionStats(meterId, days, total, total / days, peak, anomalies);
    }

    private AggregatedBucket toBucket(String period, DoubleSummaryStatistics stats) {
        double min = stats.getMin();
        double max = stats.getMax();
        // floating point summation can push the mean a hair outside [min, max]
        double average = Math.max(min, Math.min(max, stats.getAverage()));
        return new AggregatedBucket(period, stats.getSum(), average, min, max, stats.getCount());
    }

    private static String periodLabel(Instant bucketStart, BucketSize bucketSize) {
        return switch (bucketSize) {
            case HOUR -> bucketStart.toString();
            case DAY -> bucketStart.atZone(ZoneOffset.UTC).toLocalDate().toString();
        };
    }

    private static void requireInRange(String name, int value, int max) {
        if (value < 1 || value > max) {
            throw new IllegalArgumentException(name + " must be between 1 and " + max + " (was " + value + ")");
        }
    }

    private void requireMeter(long meterId) {
        if (!meterRepository.existsById(meterId)) {
            throw NotFoundException.meter(meterId);
        }
    }
}
