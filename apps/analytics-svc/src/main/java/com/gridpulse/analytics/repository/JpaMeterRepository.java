package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.entity.MeterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaMeterRepository extends JpaRepository<MeterEntity, Long> {
}
