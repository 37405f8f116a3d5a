package com.gridpulse.analytics.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "meters")
public class MeterEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "site_id")
    private Long siteId;

    @Column(name = "meter_code", nullable = false, unique = true, length = 100)
    private String meterCode;

    @Column(name = "meter_type", nullable = false, length = 50)
    private String meterType;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public MeterEntity() {}

    public MeterEntity(Long id, Long siteId, String meterCode, String meterType, boolean active, Instant createdAt) {
        this.id = id;
        this.siteId = siteId;
        this.meterCode = meterCode;
        this.meterType = meterType;
        this.active = active;
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

    public Long getSiteId() { return siteId; }
    public void setSiteId(Long siteId) { this.siteId = siteId; }

    public String getMeterCode() { return meterCode; }
    public void setMeterCode(String meterCode) { this.meterCode = meterCode; }

    public String getMeterType() { return meterType; }
    public void setMeterType(String meterType) { this.meterType = meterType; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
