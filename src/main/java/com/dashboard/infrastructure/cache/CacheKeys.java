package com.dashboard.infrastructure.cache;

import com.dashboard.domain.catalog.AnalyticsOperation;
import com.dashboard.domain.catalog.AnalyticsQuery;

/**
 * Cache key derivation for query results.
 * 
 * Format: {@code operation_name:value1:value2}, values ordered by parameter
 * name. Text values carry an {@code s=} marker and absent optional values
 * render as a bare {@code -}, so no supplied value can stand in for an absent
 * one. Examples: {@code dashboard_metrics:24}, {@code cohort_analysis:-:12},
 * {@code cohort_analysis:s=organic:12}.
 */
public final class CacheKeys {

    static final String SEPARATOR = ":";
    static final String ABSENT = "-";
    static final String TEXT_MARKER = "s=";

    private CacheKeys() {
    }

    public static String forQuery(AnalyticsQuery query) {
        return generate(query.getOperation().getOperationName(), query.getParameters().values().toArray());
    }

    /**
     * Prefix shared by every cached variant of an operation.
     */
    public static String prefixOf(AnalyticsOperation operation) {
        return operation.getOperationName() + SEPARATOR;
    }

    public static String generate(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(SEPARATOR).append(render(param));
        }
        return key.toString();
    }

    private static String render(Object param) {
        if (param == null) {
            return ABSENT;
        }
        if (param instanceof CharSequence) {
            return TEXT_MARKER + param;
        }
        return param.toString();
    }
}
