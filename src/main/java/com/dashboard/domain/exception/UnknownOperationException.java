package com.dashboard.domain.exception;

/**
 * Raised when an operation name is not part of the analytics catalog.
 */
public class UnknownOperationException extends AnalyticsException {

    private final String operationName;

    public UnknownOperationException(String operationName) {
        super("Unknown analytics operation: " + operationName);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
