package com.gridpulse.analytics.error;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException meter(long meterId) {
        return new NotFoundException("Meter " + meterId + " not found");
    }

    public static NotFoundException reading(long readingId) {
        return new NotFoundException("Reading " + readingId + " not found");
    }
}
