package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.model.Meter;

public interface MeterRepository {

    Meter save(Meter meter);

    boolean existsById(long meterId);
}
