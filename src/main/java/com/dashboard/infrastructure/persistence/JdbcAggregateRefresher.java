package com.dashboard.infrastructure.persistence;

import com.dashboard.config.DashboardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Refreshes mv_hourly_metrics, mv_cohort_retention and mv_funnel_daily
 * through the {@code refresh_dashboard_views()} database function.
 */
@Slf4j
@Component
public class JdbcAggregateRefresher implements AggregateRefresher {

    static final String REFRESH_VIEWS = "SELECT refresh_dashboard_views()";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transaction;

    public JdbcAggregateRefresher(JdbcTemplate jdbcTemplate,
                                  PlatformTransactionManager transactionManager,
                                  DashboardProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transaction = new TransactionTemplate(transactionManager);
        this.transaction.setTimeout((int) properties.getRefresh().getTimeout().toSeconds());
    }

    @Override
    public void refreshAggregates() {
        long startTime = System.currentTimeMillis();
        transaction.executeWithoutResult(status -> jdbcTemplate.execute(REFRESH_VIEWS));
        log.info("Materialized views refreshed in {} ms", System.currentTimeMillis() - startTime);
    }
}
