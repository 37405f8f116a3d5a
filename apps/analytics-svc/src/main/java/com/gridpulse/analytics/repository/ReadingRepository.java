package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.DetectionResult;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.WindowSpec;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-meter time series of readings and the derived anomaly fields written back by detection.
 * Every list returned in ascending order is sorted by timestamp, then id.
 */
public interface ReadingRepository {

    Reading save(Reading reading);

    Optional<Reading> findById(long readingId);

    /**
     * Readings of the meter covered by the window, ascending. A lookback window keeps readings at or after
     * {@code now - lookback}.
     */
    List<Reading> loadWindow(long meterId, WindowSpec window, Instant now);

    /**
     * Writes every result or none of them. Each result must reference a reading of {@code meterId}.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when a result references a missing reading
     *                                                                 or one of another meter; nothing is written
     */
    void saveDetectionResults(long meterId, List<DetectionResult> results);

    /**
     * Sets the status of a flagged reading.
     *
     * @return false when the reading does not exist or is not flagged
     */
    boolean updateStatus(long readingId, AnomalyStatus status);

    /**
     * Readings with {@code fromInclusive <= timestamp <= toInclusive}, ascending; all meters when
     * {@code meterId} is empty.
     */
    List<Reading> queryRange(Optional<Long> meterId, Instant fromInclusive, Instant toInclusive);

    /**
     * Flagged readings of every meter within the range, newest first (timestamp, then id), at most {@code limit}.
     */
    List<Reading> findAnomalies(Instant fromInclusive, Instant toInclusive, int limit);

    /**
     * Newest-first listing for dashboards.
     */
    List<Reading> findLatest(Optional<Long> meterId, Optional<Instant> fromInclusive, Optional<Instant> toInclusive,
                             boolean onlyAnomalies, int limit);

    /**
     * Clears flag, score and status on every flagged reading of the meter.
     *
     * @return number of readings cleared
     */
    int clearDetection(long meterId);
}
