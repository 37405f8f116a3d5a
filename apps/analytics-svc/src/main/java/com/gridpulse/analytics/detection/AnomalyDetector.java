package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.ScoredReading;
import java.util.List;

/**
 * Stateless scoring over one meter's time-ordered window.
 * <p>
 * Implementations return exactly one {@link ScoredReading} per input reading, in input order,
 * and depend on nothing but the window and the settings.
 */
public interface AnomalyDetector {

    List<ScoredReading> detect(List<Reading> window, DetectorSettings settings);

    /**
     * Smallest window on which this detector can flag anything. Smaller windows score every reading 0.
     */
    int minimumWindow(DetectorSettings settings);
}
