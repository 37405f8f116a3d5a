package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores each reading by its signed distance from the window mean, in sample standard deviations.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    @Override
    public List<ScoredReading> detect(List<Reading> window, DetectorSettings settings) {
        double[] values = Detectors.values(window);
        if (values.length < minimumWindow(settings)) {
            return Detectors.unscored(window);
        }
        double mean = WindowStatistics.mean(values, 0, values.length);
        double stdDev = WindowStatistics.sampleStdDev(values, 0, values.length, mean);
        if (stdDev == 0d) {
            return Detectors.unscored(window);
        }
        List<ScoredReading> scored = new ArrayList<>(window.size());
        for (int i = 0; i < values.length; i++) {
            double zScore = (values[i] - mean) / stdDev;
            scored.add(new ScoredReading(window.get(i), Math.abs(zScore) > settings.zScoreThreshold(), zScore));
        }
        return scored;
    }

    @Override
    public int minimumWindow(DetectorSettings settings) {
        return 2;
    }
}
