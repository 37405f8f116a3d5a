package com.gridpulse.analytics.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gridpulse.analytics.error.DetectionInProgressException;
import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.DetectionMethod;
import com.gridpulse.analytics.model.DetectionReport;
import com.gridpulse.analytics.model.Meter;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.WindowSpec;
import com.gridpulse.analytics.repository.InMemoryMeterRepository;
import com.gridpulse.analytics.repository.InMemoryReadingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalyDetectionServiceTest {

    private static final Instant NOW = Instant.parse("2024-02-01T12:00:00Z");

    private InMemoryReadingRepository readings;
    private InMemoryMeterRepository meters;
    private MeterLockRegistry locks;
    private AnomalyDetectionService service;
    private ExecutorService executor;
    private long meterId;

    @BeforeEach
    void setUp() {
        readings = new InMemoryReadingRepository();
        meters = new InMemoryMeterRepository();
        locks = new MeterLockRegistry(Duration.ofMillis(100));
        service = new AnomalyDetectionService(readings, meters, locks,
                new ZScoreDetector(), new IqrDetector(), new MovingAverageDetector(),
                DetectorSettings.defaults().withZScoreThreshold(1.5), Clock.fixed(NOW, ZoneOffset.UTC));
        executor = Executors.newSingleThreadExecutor();
        meterId = meters.save(new Meter(null, 1L, "MTR-001", "electric", true)).id();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void flagsSpikeAsPending() {
        seed(10, 10, 10, 10, 50);

        DetectionReport report = service.runDetection(meterId, "zscore", WindowSpec.lastDays(30));

        assertThat(report.anomaliesDetected()).isEqualTo(1);
        assertThat(report.windowSize()).isEqualTo(5);
        assertThat(report.insufficientData()).isFalse();
        assertThat(report.message()).isEqualTo("1 anomalies detected and flagged");
        assertThat(flagged()).singleElement().satisfies(reading -> {
            assertThat(reading.valueKwh()).isEqualTo(50);
            assertThat(reading.anomalyStatus()).isEqualTo(AnomalyStatus.PENDING);
            assertThat(reading.anomalyScore()).isPositive();
        });
    }

    @Test
    void rerunIsIdempotent() {
        seed(10, 10, 10, 10, 50);

        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());
        List<Reading> first = all();
        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());

        assertThat(all()).isEqualTo(first);
    }

    @Test
    void rerunKeepsReviewedStatus() {
        seed(10, 10, 10, 10, 50);
        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());
        Reading spike = flagged().get(0);
        readings.updateStatus(spike.id(), AnomalyStatus.VERIFIED);

        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());

        assertThat(readings.findById(spike.id())).get()
                .extracting(Reading::anomalyStatus)
                .isEqualTo(AnomalyStatus.VERIFIED);
    }

    @Test
    void runReplacesPreviousResultsInWindow() {
        seed(1, 2, 3, 4, 5, 100);
        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());
        assertThat(flagged()).isNotEmpty();

        service.runDetection(meterId, "iqr", WindowSpec.all());

        assertThat(flagged()).singleElement()
                .satisfies(reading -> assertThat(reading.valueKwh()).isEqualTo(100));
        assertThat(all()).filteredOn(reading -> !reading.anomaly())
                .allSatisfy(reading -> {
                    assertThat(reading.anomalyScore()).isNull();
                    assertThat(reading.anomalyStatus()).isNull();
                });
    }

    @Test
    void readingsOutsideWindowAreUntouched() {
        Reading old = readings.save(Reading.of(meterId, NOW.minus(Duration.ofDays(40)), 999)
                .flagged(7.5, AnomalyStatus.IGNORED));
        seed(10, 10, 10, 10, 10);

        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.lastDays(30));

        assertThat(readings.findById(old.id())).contains(old);
    }

    @Test
    void insufficientDataIsReportedAndClearsStaleFlags() {
        Reading stale = readings.save(Reading.of(meterId, NOW.minus(Duration.ofHours(1)), 40)
                .flagged(3.1, AnomalyStatus.PENDING));

        DetectionReport report = service.runDetection(meterId, DetectionMethod.MOVING_AVERAGE, WindowSpec.lastHours(24));

        assertThat(report.insufficientData()).isTrue();
        assertThat(report.anomaliesDetected()).isZero();
        assertThat(report.message()).contains("Not enough readings");
        assertThat(readings.findById(stale.id())).get().extracting(Reading::anomaly).isEqualTo(false);
    }

    @Test
    void unknownMeterIsNotFound() {
        assertThatThrownBy(() -> service.runDetection(999L, DetectionMethod.ZSCORE, WindowSpec.all()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.resetAnomalies(999L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void unknownMethodIsRejected() {
        seed(10, 10, 50);

        assertThatThrownBy(() -> service.runDetection(meterId, "median", WindowSpec.all()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
        assertThat(flagged()).isEmpty();
    }

    @Test
    void resetClearsEveryFlag() {
        seed(10, 10, 10, 10, 50);
        service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all());

        int cleared = service.resetAnomalies(meterId);

        assertThat(cleared).isEqualTo(1);
        assertThat(flagged()).isEmpty();
    }

    @Test
    void concurrentRunOnSameMeterIsRejected() throws Exception {
        seed(10, 10, 10, 10, 50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = executor.submit(() -> locks.withMeterLock(meterId, () -> {
            held.countDown();
            await(release);
            return null;
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThat(locks.isLocked(meterId)).isTrue();
            assertThatThrownBy(() -> service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all()))
                    .isInstanceOf(DetectionInProgressException.class);
        } finally {
            release.countDown();
        }
        holder.get(5, TimeUnit.SECONDS);

        assertThat(service.runDetection(meterId, DetectionMethod.ZSCORE, WindowSpec.all()).anomaliesDetected()).isEqualTo(1);
    }

    @Test
    void everyMethodHasADetector() {
        for (DetectionMethod method : DetectionMethod.values()) {
            assertThat(service.detectorFor(method)).isNotNull();
        }
        assertThat(service.settings().zScoreThreshold()).isEqualTo(1.5);
    }

    private void seed(double... values) {
        Instant first = NOW.minus(Duration.ofHours(values.length));
        for (int i = 0; i < values.length; i++) {
            readings.save(Reading.of(meterId, first.plus(Duration.ofHours(i)), values[i]));
        }
    }

    private List<Reading> all() {
        return readings.loadWindow(meterId, WindowSpec.all(), NOW);
    }

    private List<Reading> flagged() {
        return all().stream().filter(Reading::anomaly).toList();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
