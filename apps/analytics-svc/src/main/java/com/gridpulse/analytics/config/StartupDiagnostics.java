package com.gridpulse.analytics.config;

import com.gridpulse.analytics.detection.DetectorSettings;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final GridpulseProperties props;

    public StartupDiagnostics(GridpulseProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var detection = props.detection();
        log.info("Detection config: zScoreThreshold={}, iqrMultiplier={}, movingAverageWindow={}, movingAverageThreshold={}",
                detection.zScoreThreshold(), detection.iqrMultiplier(),
                detection.movingAverageWindow(), detection.movingAverageThreshold());
        log.info("Moving average scores are bounded by {} for window {}",
                String.format("%.3f", DetectorSettings.maxMovingAverageScore(detection.movingAverageWindow())),
                detection.movingAverageWindow());
        log.info("Detection defaults: lookbackDays={}, lockTimeout={}",
                detection.defaultLookbackDays(), detection.lockTimeout());
    }
}
