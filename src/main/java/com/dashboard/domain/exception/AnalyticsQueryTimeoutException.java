package com.dashboard.domain.exception;

import java.time.Duration;

/**
 * Raised when an analytical query exceeds its statement timeout.
 * 
 * The query is reported as failed; partial rows are never returned.
 */
public class AnalyticsQueryTimeoutException extends AnalyticsException {

    private final String operationName;
    private final Duration timeout;

    public AnalyticsQueryTimeoutException(String operationName, Duration timeout, Throwable cause) {
        super("Query '" + operationName + "' exceeded timeout of " + timeout.toSeconds() + "s", cause);
        this.operationName = operationName;
        this.timeout = timeout;
    }

    public String getOperationName() {
        return operationName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
