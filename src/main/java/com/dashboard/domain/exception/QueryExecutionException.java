package com.dashboard.domain.exception;

/**
 * Raised when the relational store fails an analytical query for a reason other than a timeout.
 */
public class QueryExecutionException extends AnalyticsException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
