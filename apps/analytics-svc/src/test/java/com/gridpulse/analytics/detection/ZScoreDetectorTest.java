package com.gridpulse.analytics.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.gridpulse.analytics.model.ScoredReading;
import java.util.List;
import org.junit.jupiter.api.Test;

class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector();

    @Test
    void spikeStaysBelowDefaultThreshold() {
        List<ScoredReading> scored = detector.detect(TestReadings.hourly(10, 10, 10, 10, 50), DetectorSettings.defaults());

        assertThat(scored).hasSize(5).noneMatch(ScoredReading::anomaly);
        assertThat(scored.get(4).score()).isCloseTo(1.789, within(0.001));
        assertThat(scored.get(0).score()).isCloseTo(-0.447, within(0.001));
    }

    @Test
    void spikeIsFlaggedWithLowerThreshold() {
        DetectorSettings settings = DetectorSettings.defaults().withZScoreThreshold(1.5);

        List<ScoredReading> scored = detector.detect(TestReadings.hourly(10, 10, 10, 10, 50), settings);

        assertThat(scored).filteredOn(ScoredReading::anomaly)
                .singleElement()
                .satisfies(candidate -> assertThat(candidate.reading().valueKwh()).isEqualTo(50));
    }

    @Test
    void thresholdIsStrict() {
        double spikeScore = detector.detect(TestReadings.hourly(10, 10, 10, 10, 50), DetectorSettings.defaults())
                .get(4).score();

        List<ScoredReading> scored = detector.detect(TestReadings.hourly(10, 10, 10, 10, 50),
                DetectorSettings.defaults().withZScoreThreshold(spikeScore));

        assertThat(scored).noneMatch(ScoredReading::anomaly);
    }

    @Test
    void constantWindowScoresZero() {
        List<ScoredReading> scored = detector.detect(TestReadings.hourly(7, 7, 7, 7), DetectorSettings.defaults());

        assertThat(scored).allSatisfy(candidate -> {
            assertThat(candidate.anomaly()).isFalse();
            assertThat(candidate.score()).isZero();
        });
    }

    @Test
    void singleReadingIsNeverFlagged() {
        assertThat(detector.detect(TestReadings.hourly(1000), DetectorSettings.defaults()))
                .singleElement()
                .satisfies(candidate -> assertThat(candidate.anomaly()).isFalse());
        assertThat(detector.detect(List.of(), DetectorSettings.defaults())).isEmpty();
    }

    @Test
    void scoresFollowInputOrder() {
        List<ScoredReading> scored = detector.detect(TestReadings.hourly(50, 10, 10, 10, 10),
                DetectorSettings.defaults().withZScoreThreshold(1.5));

        assertThat(scored.get(0).anomaly()).isTrue();
        assertThat(scored.get(0).reading().id()).isEqualTo(1L);
    }
}
