package com.herzen.maxviews.overrides;

public class InvalidOverrideException extends RuntimeException {
    public InvalidOverrideException(String message) {
        super(message);
    }
}
