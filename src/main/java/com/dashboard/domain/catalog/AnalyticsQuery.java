package com.dashboard.domain.catalog;

import java.util.Map;

/**
 * Typed parameter set of one catalog operation.
 * 
 * Subclasses carry bean validation constraints on their fields; the serving
 * layer validates them before touching the cache or the database.
 */
public abstract class AnalyticsQuery {

    public abstract AnalyticsOperation getOperation();

    /**
     * Bind parameters keyed by the names used in the SQL template.
     * 
     * Iteration order is sorted by parameter name, which keeps derived cache keys stable.
     * Optional parameters that are absent map to {@code null}.
     */
    public abstract Map<String, Object> getParameters();
}
