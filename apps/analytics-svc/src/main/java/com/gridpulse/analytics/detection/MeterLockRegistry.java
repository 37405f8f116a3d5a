package com.gridpulse.analytics.detection;

import com.gridpulse.analytics.config.GridpulseProperties;
import com.gridpulse.analytics.error.DetectionInProgressException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-meter mutual exclusion for operations that read-modify-write a meter's readings.
 */
@Component
public class MeterLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(MeterLockRegistry.class);

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    @Autowired
    public MeterLockRegistry(GridpulseProperties properties) {
        this(properties.detection().lockTimeout());
    }

    MeterLockRegistry(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("lock timeout must not be negative");
        }
        this.timeout = timeout;
    }

    public <T> T withMeterLock(long meterId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(meterId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectionInProgressException(meterId, "Interrupted while waiting for meter " + meterId, e);
        }
        if (!acquired) {
            log.warn("Meter {} is busy: lock not acquired within {}", meterId, timeout);
            throw new DetectionInProgressException(meterId,
                    "Another detection run is in progress for meter " + meterId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isLocked(long meterId) {
        ReentrantLock lock = locks.get(meterId);
        return lock != null && lock.isLocked();
    }
}
