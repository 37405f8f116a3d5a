package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.model.AnomalyStatus;
import com.gridpulse.analytics.model.DetectionResult;
import com.gridpulse.analytics.model.Reading;
import com.gridpulse.analytics.model.WindowSpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryReadingRepository implements ReadingRepository {

    static final Comparator<Reading> CHRONOLOGICAL = Comparator.comparing(Reading::timestamp)
            .thenComparing(Reading::id);

    private final Map<Long, Reading> storage = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Reading save(Reading reading) {
        return write(() -> {
            Reading stored = reading.id() == null ? reading.withId(sequence.incrementAndGet()) : reading;
            storage.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Optional<Reading> findById(long readingId) {
        return read(() -> Optional.ofNullable(storage.get(readingId)));
    }

    @Override
    public List<Reading> loadWindow(long meterId, WindowSpec window, Instant now) {
        Optional<Instant> start = window.startFrom(now);
        return select(reading -> reading.meterId() == meterId
                && start.map(from -> !reading.timestamp().isBefore(from)).orElse(true), CHRONOLOGICAL, Integer.MAX_VALUE);
    }

    @Override
    public void saveDetectionResults(long meterId, List<DetectionResult> results) {
        write(() -> {
            for (DetectionResult result : results) {
                Reading current = storage.get(result.readingId());
                if (current == null || current.meterId() != meterId) {
                    throw new DataIntegrityViolationException("Reading " + result.readingId() + " does not belong to meter " + meterId);
                }
            }
            for (DetectionResult result : results) {
                storage.computeIfPresent(result.readingId(), (id, current) -> result.applyTo(current));
            }
            return null;
        });
    }

    @Override
    public boolean updateStatus(long readingId, AnomalyStatus status) {
        return write(() -> {
            Reading current = storage.get(readingId);
            if (current == null || !current.anomaly()) {
                return false;
            }
            storage.put(readingId, current.withStatus(status));
            return true;
        });
    }

    @Override
    public List<Reading> queryRange(Optional<Long> meterId, Instant fromInclusive, Instant toInclusive) {
        return select(reading -> meterId.map(id -> id == reading.meterId()).orElse(true)
                && within(reading, Optional.of(fromInclusive), Optional.of(toInclusive)), CHRONOLOGICAL, Integer.MAX_VALUE);
    }

    @Override
    public List<Reading> findAnomalies(Instant fromInclusive, Instant toInclusive, int limit) {
        return select(reading -> reading.anomaly()
                && within(reading, Optional.of(fromInclusive), Optional.of(toInclusive)), CHRONOLOGICAL.reversed(), limit);
    }

    @Override
    public List<Reading> findLatest(Optional<Long> meterId, Optional<Instant> fromInclusive, Optional<Instant> toInclusive,
                                    boolean onlyAnomalies, int limit) {
        return select(reading -> meterId.map(id -> id == reading.meterId()).orElse(true)
                && (!onlyAnomalies || reading.anomaly())
                && within(reading, fromInclusive, toInclusive), CHRONOLOGICAL.reversed(), limit);
    }

    @Override
    public int clearDetection(long meterId) {
        return write(() -> {
            int cleared = 0;
            for (Map.Entry<Long, Reading> entry : storage.entrySet()) {
                Reading reading = entry.getValue();
                if (reading.meterId() == meterId && reading.anomaly()) {
                    entry.setValue(reading.cleared());
                    cleared++;
                }
            }
            return cleared;
        });
    }

    private static boolean within(Reading reading, Optional<Instant> fromInclusive, Optional<Instant> toInclusive) {
        Instant ts = reading.timestamp();
        return fromInclusive.map(from -> !ts.isBefore(from)).orElse(true)
                && toInclusive.map(to -> !ts.isAfter(to)).orElse(true);
    }

    private List<Reading> select(Predicate<Reading> filter, Comparator<Reading> order, int limit) {
        return read(() -> storage.values().stream()
                .filter(filter)
                .sorted(order)
                .limit(limit)
                .collect(Collectors.toCollection(ArrayList::new)));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
