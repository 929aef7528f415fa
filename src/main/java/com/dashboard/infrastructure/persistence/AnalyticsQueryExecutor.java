package com.dashboard.infrastructure.persistence;

import com.dashboard.domain.catalog.QueryDefinition;

import java.util.List;
import java.util.Map;

/**
 * Runs catalog queries against the relational store.
 * 
 * Parameters are always bound structurally, never interpolated into SQL text.
 */
public interface AnalyticsQueryExecutor {

    /**
     * Executes the definition's template under its timeout.
     *
     * @return rows in query order, each an ordered column → value mapping
     * @throws com.dashboard.domain.exception.AnalyticsQueryTimeoutException if the timeout is exceeded
     * @throws com.dashboard.domain.exception.QueryExecutionException on any other database failure
     */
    List<Map<String, Object>> execute(QueryDefinition definition, Map<String, Object> params);
}
