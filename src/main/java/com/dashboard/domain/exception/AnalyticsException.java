package com.dashboard.domain.exception;

/**
 * Base type for failures raised by the analytics serving layer.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
