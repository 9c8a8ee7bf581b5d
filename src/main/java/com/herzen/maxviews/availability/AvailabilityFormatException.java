package com.herzen.maxviews.availability;

public class AvailabilityFormatException extends RuntimeException {
    public AvailabilityFormatException(String message) {
        super(message);
    }

    public AvailabilityFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
