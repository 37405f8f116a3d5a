package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import java.util.List;

final class Detectors {

    private Detectors() {
    }

    static double[] values(List<Reading> window) {
        double[] values = new double[window.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = window.get(i).valueKwh();
        }
        return values;
    }

    static List<ScoredReading> unscored(List<Reading> window) {
        return window.stream()
                .map(reading -> new ScoredReading(reading, false, 0d))
                .toList();
    }
}
