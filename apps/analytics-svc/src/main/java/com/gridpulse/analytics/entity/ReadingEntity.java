package com.gridpulse.analytics.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "consumption_readings", indexes = {
        @Index(name = "ix_meter_measured_at", columnList = "meter_id, measured_at"),
        @Index(name = "ix_readings_is_anomaly", columnList = "is_anomaly")
})
public class ReadingEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "meter_id", nullable = false)
    private Long meterId;

    @Column(name = "measured_at", nullable = false)
    private Instant measuredAt;

    @Column(name = "value_kwh", nullable = false)
    private double valueKwh;

    @Column(name = "is_anomaly", nullable = false)
    private boolean anomaly;

    @Column(name = "anomaly_score")
    private Double anomalyScore;

    @Column(name = "anomaly_status", length = 20)
    private String anomalyStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public ReadingEntity() {}

    public ReadingEntity(Long id, Long meterId, Instant measuredAt, double valueKwh,
                         boolean anomaly, Double anomalyScore, String anomalyStatus, Instant createdAt) {
        this.id = id;
        this.meterId = meterId;
        this.measuredAt = measuredAt;
        this.valueKwh = valueKwh;
        this.anomaly = anomaly;
        this.anomalyScore = anomalyScore;
        this.anomalyStatus = anomalyStatus;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getMeterId() { return meterId; }
    public void setMeterId(Long meterId) { this.meterId = meterId; }

    public Instant getMeasuredAt() { return measuredAt; }
    public void setMeasuredAt(Instant measuredAt) { this.measuredAt = measuredAt; }

    public double getValueKwh() { return valueKwh; }
    public void setValueKwh(double valueKwh) { this.valueKwh = valueKwh; }

    public boolean isAnomaly() { return anomaly; }
    public void setAnomaly(boolean anomaly) { this.anomaly = anomaly; }

    public Double getAnomalyScore() { return anomalyScore; }
    public void setAnomalyScore(Double anomalyScore) { this.anomalyScore = anomalyScore; }

    public String getAnomalyStatus() { return anomalyStatus; }
    public void setAnomalyStatus(String anomalyStatus) { this.anomalyStatus = anomalyStatus; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
