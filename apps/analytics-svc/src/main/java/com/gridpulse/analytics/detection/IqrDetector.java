package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Flags readings outside {@code [Q1 - k*IQR, Q3 + k*IQR]}. Quartiles use
 * {@link WindowStatistics#percentile(double[], double) linear interpolation}.
 * The score is the signed distance past the crossed bound, in IQR units; readings inside score 0.
 */
@Component
public class IqrDetector implements AnomalyDetector {

    @Override
    public List<ScoredReading> detect(List<Reading> window, DetectorSettings settings) {
        double[] values = Detectors.values(window);
        if (values.length < minimumWindow(settings)) {
            return Detectors.unscored(window);
        }
        Bounds bounds = bounds(values, settings.iqrMultiplier());
        if (bounds.iqr() == 0d) {
            return Detectors.unscored(window);
        }
        List<ScoredReading> scored = new ArrayList<>(window.size());
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value < bounds.lower()) {
                scored.add(new ScoredReading(window.get(i), true, (value - bounds.lower()) / bounds.iqr()));
            } else if (value > bounds.upper()) {
                scored.add(new ScoredReading(window.get(i), true, (value - bounds.upper()) / bounds.iqr()));
            } else {
                scored.add(new ScoredReading(window.get(i), false, 0d));
            }
        }
        return scored;
    }

    @Override
    public int minimumWindow(DetectorSettings settings) {
        return 4;
    }

    static Bounds bounds(double[] values, double multiplier) {
        double[] sorted = WindowStatistics.sortedCopy(values);
        double q1 = WindowStatistics.percentile(sorted, 25);
        double q3 = WindowStatistics.percentile(sorted, 75);
        double iqr = q3 - q1;
        return new Bounds(q1, q3, iqr, q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    record Bounds(double q1, double q3, double iqr, double lower, double upper) {
    }
}
