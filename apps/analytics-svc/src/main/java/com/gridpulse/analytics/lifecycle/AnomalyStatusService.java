package com.gridpulse.analytics.lifecycle;

import com.gridpulse.analytics.detection.MeterLockRegistry;
import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.StatusChange;
import com.gridpulse.analytics.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Review workflow of flagged readings. Every status may be set from every other status, including
 * reopening a verified or ignored anomaly back to pending.
 */
@Service
public class AnomalyStatusService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyStatusService.class);

    private final ReadingRepository readingRepository;
    private final MeterLockRegistry meterLocks;

    public AnomalyStatusService(ReadingRepository readingRepository, MeterLockRegistry meterLocks) {
        this.readingRepository = readingRepository;
        this.meterLocks = meterLocks;
    }

    public StatusChange setStatus(long readingId, String status) {
        return setStatus(readingId, AnomalyStatus.fromValue(status));
    }

    public StatusChange setStatus(long readingId, AnomalyStatus newStatus) {
        if (newStatus == null) {
            throw new IllegalArgumentException("status must be provided");
        }
        Reading reading = requireFlagged(readingId);
        long meterId = reading.meterId();
        return meterLocks.withMeterLock(meterId, () -> {
            // re-read under the lock: a detection run may have cleared the flag meanwhile
            Reading current = requireFlagged(readingId);
            AnomalyStatus previous = current.anomalyStatus() != null ? current.anomalyStatus() : AnomalyStatus.PENDING;
            if (!readingRepository.updateStatus(readingId, newStatus)) {
                throw notFlagged(readingId);
            }
            log.info("Anomaly status changed: reading={}, meter={}, {} -> {}",
                    readingId, meterId, previous.value(), newStatus.value());
            return new StatusChange(readingId, meterId, previous, newStatus,
                    "Status updated: " + newStatus.value());
        });
    }

    private Reading requireFlagged(long readingId) {
        Reading reading = readingRepository.findById(readingId)
                .orElseThrow(() -> NotFoundException.reading(readingId));
        if (!reading.anomaly()) {
            throw notFlagged(readingId);
        }
        return reading;
    }

    private static NotFoundException notFlagged(long readingId) {
        return new NotFoundException("Reading " + readingId + " is not flagged as an anomaly");
    }
}
