package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Compares each reading to the trailing window of W readings ending at (and including) it.
 * The first W - 1 readings never have a full window and always score 0.
 */
@Component
public class MovingAverageDetector implements AnomalyDetector {

    @Override
    public List<ScoredReading> detect(List<Reading> window, DetectorSettings settings) {
        int size = settings.movingAverageWindow();
        double[] values = Detectors.values(window);
        List<ScoredReading> scored = new ArrayList<>(window.size());
        for (int i = 0; i < values.length; i++) {
            if (i < size - 1) {
                scored.add(new ScoredReading(window.get(i), false, 0d));
                continue;
            }
            int from = i - size + 1;
            double mean = WindowStatistics.mean(values, from, i + 1);
            double stdDev = WindowStatistics.sampleStdDev(values, from, i + 1, mean);
            if (stdDev == 0d) {
                scored.add(new ScoredReading(window.get(i), false, 0d));
                continue;
            }
            double score = (values[i] - mean) / stdDev;
            scored.add(new ScoredReading(window.get(i), Math.abs(score) > settings.movingAverageThreshold(), score));
        }
        return scored;
    }

    @Override
    public int minimumWindow(DetectorSettings settings) {
        return settings.movingAverageWindow();
    }
}
