package com.dashboard.domain.exception;

/**
 * Raised inside a refresh cycle when aggregate recomputation or cache invalidation fails.
 */
public class RefreshFailedException extends AnalyticsException {

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
