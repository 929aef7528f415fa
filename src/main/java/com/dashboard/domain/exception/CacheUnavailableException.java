package com.dashboard.domain.exception;

/**
 * Raised by a cache store when the backend cannot serve a request.
 * 
 * Never surfaced to API callers: readers treat it as a miss, writers as a no-op.
 */
public class CacheUnavailableException extends AnalyticsException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
