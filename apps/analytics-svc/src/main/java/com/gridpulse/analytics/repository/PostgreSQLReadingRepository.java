package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.entity.ReadingEntity;
import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.DetectionResult;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.WindowSpec;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class PostgreSQLReadingRepository implements ReadingRepository {

    // open-ended listing bounds; kept inside the range every supported database accepts
    private static final Instant EARLIEST = Instant.parse("1900-01-01T00:00:00Z");
    private static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private final JpaReadingRepository jpaReadingRepository;

    public PostgreSQLReadingRepository(JpaReadingRepository jpaReadingRepository) {
        this.jpaReadingRepository = jpaReadingRepository;
    }

    @Override
    @Transactional
    public Reading save(Reading reading) {
        ReadingEntity saved = jpaReadingRepository.save(toEntity(reading));
        return toModel(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Reading> findById(long readingId) {
        return jpaReadingRepository.findById(readingId).map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> loadWindow(long meterId, WindowSpec window, Instant now) {
        List<ReadingEntity> entities = window.startFrom(now)
                .map(from -> jpaReadingRepository.findByMeterIdSince(meterId, from))
                .orElseGet(() -> jpaReadingRepository.findByMeterId(meterId));
        return toModels(entities);
    }

    @Override
    @Transactional
    public void saveDetectionResults(long meterId, List<DetectionResult> results) {
        if (results.isEmpty()) {
            return;
        }
        List<Long> ids = results.stream().map(DetectionResult::readingId).toList();
        Map<Long, ReadingEntity> entities = jpaReadingRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(ReadingEntity::getId, Function.identity()));
        for (DetectionResult result : results) {
            ReadingEntity entity = entities.get(result.readingId());
            if (entity == null || entity.getMeterId() != meterId) {
                // rolls back the whole run
                throw new DataIntegrityViolationException("Reading " + result.readingId() + " does not belong to meter " + meterId);
            }
            entity.setAnomaly(result.anomaly());
            entity.setAnomalyScore(result.score());
            entity.setAnomalyStatus(result.status() != null ? result.status().value() : null);
        }
        jpaReadingRepository.saveAll(entities.values());
    }

    @Override
    @Transactional
    public boolean updateStatus(long readingId, AnomalyStatus status) {
        return jpaReadingRepository.updateStatusIfFlagged(readingId, status.value()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> queryRange(Optional<Long> meterId, Instant fromInclusive, Instant toInclusive) {
        List<ReadingEntity> entities = meterId
                .map(id -> jpaReadingRepository.findByMeterIdAndRange(id, fromInclusive, toInclusive))
                .orElseGet(() -> jpaReadingRepository.findByRange(fromInclusive, toInclusive));
        return toModels(entities);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> findAnomalies(Instant fromInclusive, Instant toInclusive, int limit) {
        return toModels(jpaReadingRepository.findAnomaliesInRange(fromInclusive, toInclusive, PageRequest.of(0, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reading> findLatest(Optional<Long> meterId, Optional<Instant> fromInclusive, Optional<Instant> toInclusive,
                                    boolean onlyAnomalies, int limit) {
        return toModels(jpaReadingRepository.findLatest(
                meterId.orElse(null),
                fromInclusive.orElse(EARLIEST),
                toInclusive.orElse(LATEST),
                onlyAnomalies,
                PageRequest.of(0, limit)));
    }

    @Override
    @Transactional
    public int clearDetection(long meterId) {
        return jpaReadingRepository.clearDetectionByMeterId(meterId);
    }

    private List<Reading> toModels(List<ReadingEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        return entities.stream().map(this::toModel).collect(Collectors.toList());
    }

    private Reading toModel(ReadingEntity entity) {
        if (!entity.isAnomaly()) {
            return new Reading(entity.getId(), entity.getMeterId(), entity.getMeasuredAt(), entity.getValueKwh(),
                    false, null, null);
        }
        // rows flagged before statuses existed have no status; they are awaiting review
        AnomalyStatus status = entity.getAnomalyStatus() == null
                ? AnomalyStatus.PENDING
                : AnomalyStatus.fromValue(entity.getAnomalyStatus());
        return new Reading(entity.getId(), entity.getMeterId(), entity.getMeasuredAt(), entity.getValueKwh(),
                true, entity.getAnomalyScore(), status);
    }

    private ReadingEntity toEntity(Reading reading) {
        return new ReadingEntity(
                reading.id(),
                reading.meterId(),
                reading.timestamp(),
                reading.valueKwh(),
                reading.anomaly(),
                reading.anomalyScore(),
                reading.anomalyStatus() != null ? reading.anomalyStatus().value() : null,
                null
        );
    }
}
