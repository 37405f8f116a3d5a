package com.gridpulse.analytics.model;

public record Meter(Long id, Long siteId, String code, String meterType, boolean active) {
}
