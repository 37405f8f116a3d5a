package com.gridpulse.analytics.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Which readings of a meter a detection run covers: all of them, or those within a lookback from "now".
 * A lookback is at most {@value #MAX_LOOKBACK_DAYS} days.
 */
public record WindowSpec(Optional<Duration> lookback) {

    public static final int MAX_LOOKBACK_DAYS = 365;
    public static final int MAX_LOOKBACK_HOURS = MAX_LOOKBACK_DAYS * 24;

    private static final Duration MAX_LOOKBACK = Duration.ofDays(MAX_LOOKBACK_DAYS);

    public WindowSpec {
        if (lookback == null) {
            lookback = Optional.empty();
        }
        lookback.ifPresent(value -> {
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException("window lookback must be positive");
            }
            if (value.compareTo(MAX_LOOKBACK) > 0) {
                throw new IllegalArgumentException("window lookback must not exceed " + MAX_LOOKBACK_DAYS + " days");
            }
        });
    }

    public static WindowSpec all() {
        return new WindowSpec(Optional.empty());
    }

    public static WindowSpec lastDays(int days) {
        requireInRange("days", days, MAX_LOOKBACK_DAYS);
        return new WindowSpec(Optional.of(Duration.ofDays(days)));
    }

    public static WindowSpec lastHours(int hours) {
        requireInRange("hours", hours, MAX_LOOKBACK_HOURS);
        return new WindowSpec(Optional.of(Duration.ofHours(hours)));
    }

    public Optional<Instant> startFrom(Instant now) {
        return lookback.map(now::minus);
    }

    public String describe() {
        return lookback.map(value -> "last " + value).orElse("all readings");
    }

    private static void requireInRange(String name, int value, int max) {
        if (value < 1 || value > max) {
            throw new IllegalArgumentException(name + " must be between 1 and " + max + " (was " + value + ")");
        }
    }
}
