package com.gridpulse.analytics.service;

import com.gridpulse.analytics.error.NotFoundException;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.repository.MeterRepository;
import com.gridpulse.analytics.repository.ReadingRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only ingestion of meter readings. Detection is never triggered from here.
 */
@Service
public class ReadingService {

    private static final Logger log = LoggerFactory.getLogger(ReadingService.class);

    public static final int MAX_LIST_LIMIT = 1000;

    private final ReadingRepository readingRepository;
    private final MeterRepository meterRepository;

    public ReadingService(ReadingRepository readingRepository, MeterRepository meterRepository) {
        this.readingRepository = readingRepository;
        this.meterRepository = meterRepository;
    }

    public Reading record(long meterId, Instant timestamp, double valueKwh) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must be provided");
        }
        if (Double.isNaN(valueKwh) || Double.isInfinite(valueKwh) || valueKwh < 0) {
            throw new IllegalArgumentException("valueKwh must be a finite number >= 0");
        }
        if (!meterRepository.existsById(meterId)) {
            throw NotFoundException.meter(meterId);
        }
        Reading saved = readingRepository.save(Reading.of(meterId, timestamp, valueKwh));
        log.debug("Recorded reading {} for meter {} at {}: {} kWh", saved.id(), meterId, timestamp, valueKwh);
        return saved;
    }

    public List<Reading> list(Optional<Long> meterId, Optional<Instant> from, Optional<Instant> to,
                              boolean onlyAnomalies, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        if (from.isPresent() && to.isPresent() && to.get().isBefore(from.get())) {
            throw new IllegalArgumentException("to must not be before from");
        }
        return readingRepository.findLatest(meterId, from, to, onlyAnomalies, limit);
    }
}
