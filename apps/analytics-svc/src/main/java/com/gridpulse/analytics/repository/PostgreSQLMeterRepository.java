package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.entity.MeterEntity;
import com.gridpulse.analytics.model.Meter;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLMeterRepository implements MeterRepository {

    private final JpaMeterRepository jpaMeterRepository;

    public PostgreSQLMeterRepository(JpaMeterRepository jpaMeterRepository) {
        this.jpaMeterRepository = jpaMeterRepository;
    }

    @Override
    public Meter save(Meter meter) {
        MeterEntity saved = jpaMeterRepository.save(new MeterEntity(
                meter.id(), meter.siteId(), meter.code(), meter.meterType(), meter.active(), null));
        return toModel(saved);
    }

    @Override
    public boolean existsById(long meterId) {
        return jpaMeterRepository.existsById(meterId);
    }

    private Meter toModel(MeterEntity entity) {
        return new Meter(entity.getId(), entity.getSiteId(), entity.getMeterCode(), entity.getMeterType(), entity.isActive());
    }
}
