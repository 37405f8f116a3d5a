package com.gridpulse.analytics.model;

import java.time.temporal.ChronoUnit;

public enum BucketSize {
    HOUR(ChronoUnit.HOURS, 90),
    DAY(ChronoUnit.DAYS, 365);

    private final ChronoUnit unit;
    private final int maxDaysBack;

    BucketSize(ChronoUnit unit, int maxDaysBack) {
        this.unit = unit;
        this.maxDaysBack = maxDaysBack;
    }

    public ChronoUnit unit() {
        return unit;
    }

    public int maxDaysBack() {
        return maxDaysBack;
    }
}
