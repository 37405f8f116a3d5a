package com.gridpulse.analytics.error;

/**
 * Raised when the meter's lock could not be acquired in time because another run holds it.
 */
public class DetectionInProgressException extends RuntimeException {

    private final long meterId;

    public DetectionInProgressException(long meterId, String message) {
        super(message);
        this.meterId = meterId;
    }

    public DetectionInProgressException(long meterId, String message, Throwable cause) {
        super(message, cause);
        this.meterId = meterId;
    }

    public long meterId() {
        return meterId;
    }
}
