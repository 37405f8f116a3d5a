package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.model.Meter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryMeterRepository implements MeterRepository {

    private final Map<Long, Meter> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Meter save(Meter meter) {
        Meter stored = meter.id() == null
                ? new Meter(sequence.incrementAndGet(), meter.siteId(), meter.code(), meter.meterType(), meter.active())
                : meter;
        storage.put(stored.id(), stored);
        return stored;
    }

    @Override
    public boolean existsById(long meterId) {
        return storage.containsKey(meterId);
    }
}
