package com.gridpulse.analytics.config;

import com.gridpulse.analytics.detection.DetectorSettings;
import com.gridpulse.analytics.model.WindowSpec;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "gridpulse")
public record GridpulseProperties(
        Detection detection
) {

    @ConstructorBinding
    public GridpulseProperties {
        // detection may be omitted entirely; every field has a default
        if (detection == null) {
            detection = new Detection(null, null, null, null, null, null);
        }
    }

    public record Detection(
            Double zScoreThreshold,
            Double iqrMultiplier,
            Integer movingAverageWindow,
            Double movingAverageThreshold,
            Integer defaultLookbackDays,
            Duration lockTimeout
    ) {
        public Detection {
            if (zScoreThreshold == null) zScoreThreshold = DetectorSettings.DEFAULT_Z_SCORE_THRESHOLD;
            if (iqrMultiplier == null) iqrMultiplier = DetectorSettings.DEFAULT_IQR_MULTIPLIER;
            if (movingAverageWindow == null) movingAverageWindow = DetectorSettings.DEFAULT_MOVING_AVERAGE_WINDOW;
            if (movingAverageThreshold == null) movingAverageThreshold = DetectorSettings.DEFAULT_MOVING_AVERAGE_THRESHOLD;
            if (defaultLookbackDays == null) defaultLookbackDays = 30;
            if (lockTimeout == null) lockTimeout = Duration.ofSeconds(30);
            if (defaultLookbackDays <= 0 || defaultLookbackDays > WindowSpec.MAX_LOOKBACK_DAYS) {
                throw new IllegalArgumentException(
                        "defaultLookbackDays must be between 1 and " + WindowSpec.MAX_LOOKBACK_DAYS);
            }
            if (lockTimeout.isNegative()) {
                throw new IllegalArgumentException("lockTimeout must not be negative");
            }
            // fail at startup rather than on the first detection run
            toSettings(zScoreThreshold, iqrMultiplier, movingAverageWindow, movingAverageThreshold);
        }

        public DetectorSettings settings() {
            return toSettings(zScoreThreshold, iqrMultiplier, movingAverageWindow, movingAverageThreshold);
        }

        private static DetectorSettings toSettings(double z, double k, int window, double maThreshold) {
            return new DetectorSettings(z, k, window, maThreshold);
        }
    }
}
