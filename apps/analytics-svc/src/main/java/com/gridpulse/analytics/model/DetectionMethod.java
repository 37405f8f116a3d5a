package com.gridpulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum DetectionMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    MOVING_AVERAGE("moving_average");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static DetectionMethod fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("method must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DetectionMethod method : values()) {
            if (method.value.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method '" + raw + "'. Use one of: "
                + Arrays.stream(values()).map(DetectionMethod::value).collect(Collectors.joining(", ")));
    }
}
