package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.config.GridpulseProperties;
import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.DetectionMethod;
import com.gridpulse.analytics.model.DetectionReport;
import com.gridpulse.analytics.model.DetectionResult;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import com.gridpulse.analytics.model.WindowSpec;
import com.gridpulse.analytics.repository.MeterRepository;
import com.gridpulse.analytics.repository.ReadingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs a detector over a meter's window and writes the flags back.
 * <p>
 * Each run replaces the previous results for every reading in the window: readings no longer flagged lose
 * their score and status, newly flagged readings start {@link AnomalyStatus#PENDING}, and readings flagged
 * again keep the status a reviewer gave them. Runs for the same meter never overlap.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final ReadingRepository readingRepository;
    private final MeterRepository meterRepository;
    private final MeterLockRegistry meterLocks;
    private final ZScoreDetector zScoreDetector;
    private final IqrDetector iqrDetector;
    private final MovingAverageDetector movingAverageDetector;
    private final DetectorSettings settings;
    private final Clock clock;

    @Autowired
    public AnomalyDetectionService(
            ReadingRepository readingRepository,
            MeterRepository meterRepository,
            MeterLockRegistry meterLocks,
            ZScoreDetector zScoreDetector,
            IqrDetector iqrDetector,
            MovingAverageDetector movingAverageDetector,
            GridpulseProperties properties,
            Clock clock
    ) {
        this(readingRepository, meterRepository, meterLocks, zScoreDetector, iqrDetector, movingAverageDetector,
                properties.detection().settings(), clock);
    }

    AnomalyDetectionService(
            ReadingRepository readingRepository,
            MeterRepository meterRepository,
            MeterLockRegistry meterLocks,
            ZScoreDetector zScoreDetector,
            IqrDetector iqrDetector,
            MovingAverageDetector movingAverageDetector,
            DetectorSettings settings,
            Clock clock
    ) {
        this.readingRepository = readingRepository;
        this.meterRepository = meterRepository;
        this.meterLocks = meterLocks;
        this.zScoreDetector = zScoreDetector;
        this.iqrDetector = iqrDetector;
        this.movingAverageDetector = movingAverageDetector;
        this.settings = settings;
        this.clock = clock;
    }

    public DetectionReport runDetection(long meterId, String method, WindowSpec window) {
        return runDetection(meterId, DetectionMethod.fromValue(method), window);
    }

    public DetectionReport runDetection(long meterId, DetectionMethod method, WindowSpec window) {
        if (method == null) {
            throw new IllegalArgumentException("method must be provided");
        }
        if (window == null) {
            throw new IllegalArgumentException("window must be provided");
        }
        requireMeter(meterId);
        return meterLocks.withMeterLock(meterId, () -> detectAndPersist(meterId, method, window));
    }

    /**
     * Clears flag, score and status on every reading of the meter.
     *
     * @return number of readings that were flagged before the reset
     */
    public int resetAnomalies(long meterId) {
        requireMeter(meterId);
        int cleared = meterLocks.withMeterLock(meterId, () -> readingRepository.clearDetection(meterId));
        log.info("Reset anomaly flags for meter {}: {} readings cleared", meterId, cleared);
        return cleared;
    }

    public DetectorSettings settings() {
        return settings;
    }

    AnomalyDetector detectorFor(DetectionMethod method) {
        return switch (method) {
            case ZSCORE -> zScoreDetector;
            case IQR -> iqrDetector;
            case MOVING_AVERAGE -> movingAverageDetector;
        };
    }

    private DetectionReport detectAndPersist(long meterId, DetectionMethod method, WindowSpec window) {
        Instant start = clock.instant();
        List<Reading> readings = readingRepository.loadWindow(meterId, window, start);
        AnomalyDetector detector = detectorFor(method);
        boolean insufficientData = readings.size() < detector.minimumWindow(settings);
        log.info("Detection started: meter={}, method={}, window={}, readings={}",
                meterId, method.value(), window.describe(), readings.size());
        if (insufficientData) {
            log.warn("Insufficient data for {} on meter {}: {} readings, {} required; no reading will be flagged",
                    method.value(), meterId, readings.size(), detector.minimumWindow(settings));
        }

        List<ScoredReading> scored = detector.detect(readings, settings);
        List<DetectionResult> results = new ArrayList<>(scored.size());
        int flagged = 0;
        for (ScoredReading candidate : scored) {
            Reading reading = candidate.reading();
            if (candidate.anomaly()) {
                AnomalyStatus status = reading.anomaly() && reading.anomalyStatus() != null
                        ? reading.anomalyStatus()
                        : AnomalyStatus.PENDING;
                results.add(DetectionResult.flagged(reading.id(), candidate.score(), status));
                flagged++;
            } else {
                results.add(DetectionResult.clear(reading.id()));
            }
        }
        readingRepository.saveDetectionResults(meterId, results);

        long durationMs = Duration.between(start, clock.instant()).toMillis();
        log.info("Detection finished: meter={}, method={}, flagged={} of {} in {} ms",
                meterId, method.value(), flagged, readings.size(), durationMs);
        String message = insufficientData
                ? String.format("Not enough readings for %s (%d of %d required); 0 anomalies detected",
                method.value(), readings.size(), detector.minimumWindow(settings))
                : String.format("%d anomalies detected and flagged", flagged);
        return new DetectionReport(meterId, method, readings.size(), flagged, insufficientData, message);
    }

    private void requireMeter(long meterId) {
        if (!meterRepository.existsById(meterId)) {
            throw NotFoundException.meter(meterId);
        }
    }
}
