package com.gridpulse.analytics.repository;

import com.gridpulse.analytics.entity.ReadingEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaReadingRepository extends JpaRepository<ReadingEntity, Long> {

    @Query("SELECT r FROM ReadingEntity r WHERE r.meterId = :meterId ORDER BY r.measuredAt ASC, r.id ASC")
    List<ReadingEntity> findByMeterId(@Param("meterId") Long meterId);

    @Query("SELECT r FROM ReadingEntity r WHERE r.meterId = :meterId AND r.measuredAt >= :from ORDER BY r.measuredAt ASC, r.id ASC")
    List<ReadingEntity> findByMeterIdSince(@Param("meterId") Long meterId,
                                           @Param("from") Instant from);

    @Query("SELECT r FROM ReadingEntity r WHERE r.meterId = :meterId AND r.measuredAt >= :from AND r.measuredAt <= :to ORDER BY r.measuredAt ASC, r.id ASC")
    List<ReadingEntity> findByMeterIdAndRange(@Param("meterId") Long meterId,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    @Query("SELECT r FROM ReadingEntity r WHERE r.measuredAt >= :from AND r.measuredAt <= :to ORDER BY r.measuredAt ASC, r.id ASC")
    List<ReadingEntity> findByRange(@Param("from") Instant from,
                                    @Param("to") Instant to);

    @Query("SELECT r FROM ReadingEntity r WHERE r.anomaly = true AND r.measuredAt >= :from AND r.measuredAt <= :to ORDER BY r.measuredAt DESC, r.id DESC")
    List<ReadingEntity> findAnomaliesInRange(@Param("from") Instant from,
                                             @Param("to") Instant to,
                                             Pageable pageable);

    @Query("""
            SELECT r FROM ReadingEntity r
            WHERE (:meterId IS NULL OR r.meterId = :meterId)
              AND (:onlyAnomalies = false OR r.anomaly = true)
              AND r.measuredAt >= :from AND r.measuredAt <= :to
            ORDER BY r.measuredAt DESC, r.id DESC
            """)
    List<ReadingEntity> findLatest(@Param("meterId") Long meterId,
                                   @Param("from") Instant from,
                                   @Param("to") Instant to,
                                   @Param("onlyAnomalies") boolean onlyAnomalies,
                                   Pageable pageable);

    @Modifying
    @Query("UPDATE ReadingEntity r SET r.anomalyStatus = :status WHERE r.id = :id AND r.anomaly = true")
    int updateStatusIfFlagged(@Param("id") Long id, @Param("status") String status);

    @Modifying
    @Query("UPDATE ReadingEntity r SET r.anomaly = false, r.anomalyScore = null, r.anomalyStatus = null WHERE r.meterId = :meterId AND r.anomaly = true")
    int clearDetectionByMeterId(@Param("meterId") Long meterId);
}
