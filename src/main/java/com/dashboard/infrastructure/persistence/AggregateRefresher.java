package com.dashboard.infrastructure.persistence;

/**
 * Recomputes the materialized aggregates backing the dashboard views.
 */
public interface AggregateRefresher {

    /**
     * @throws org.springframework.dao.DataAccessException if recomputation fails
     */
    void refreshAggregates();
}
