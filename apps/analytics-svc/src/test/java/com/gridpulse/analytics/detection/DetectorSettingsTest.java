package com.gridpulse.analytics.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.gridpulse.analytics.model.ScoredReading;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectorSettingsTest {

    @Test
    void defaultsAreReachable() {
        DetectorSettings defaults = DetectorSettings.defaults();

        assertThat(DetectorSettings.maxMovingAverageScore(defaults.movingAverageWindow()))
                .isCloseTo(9 / Math.sqrt(10), within(1e-12))
                .isGreaterThan(defaults.movingAverageThreshold());
    }

    @Test
    void thresholdAtOrAboveTheBoundIsRejected() {
        double bound = DetectorSettings.maxMovingAverageScore(10);

        assertThatThrownBy(() -> DetectorSettings.defaults().withMovingAverage(10, 3.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("can never be exceeded");
        assertThatThrownBy(() -> DetectorSettings.defaults().withMovingAverage(10, bound))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(DetectorSettings.defaults().withMovingAverage(30, 3.0).movingAverageWindow()).isEqualTo(30);
    }

    @Test
    void boundIsTheScoreOfASingleOutlier() {
        MovingAverageDetector detector = new MovingAverageDetector();
        DetectorSettings settings = DetectorSettings.defaults().withMovingAverage(5, 1.0);

        List<ScoredReading> scored = detector.detect(TestReadings.hourly(3, 3, 3, 3, 1000), settings);

        assertThat(scored.get(4).score()).isCloseTo(DetectorSettings.maxMovingAverageScore(5), within(1e-9));
    }

    @Test
    void otherThresholdsMustBePositive() {
        assertThatThrownBy(() -> DetectorSettings.defaults().withZScoreThreshold(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorSettings.defaults().withIqrMultiplier(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorSettings.defaults().withMovingAverage(1, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
