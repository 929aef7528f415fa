package com.dashboard.domain.exception;

import java.util.List;

/**
 * Raised when query parameters fail type or range checks.
 * 
 * Always thrown before any cache lookup or query execution.
 */
public class QueryValidationException extends AnalyticsException {

    private final List<String> violations;

    public QueryValidationException(String message) {
        this(message, List.of(message));
    }

    public QueryValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
