package com.gridpulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Review state of a flagged reading. Any state may move to any other state.
 */
public enum AnomalyStatus {
    PENDING("pending"),
    VERIFIED("verified"),
    IGNORED("ignored");

    private final String value;

    AnomalyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AnomalyStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AnomalyStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status '" + raw + "'. Use one of: " + allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(AnomalyStatus::value).collect(Collectors.joining(", "));
    }
}
