package com.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Dashboard Analytics Backend
 * 
 * Serves analytical queries over PostgreSQL materialized views to real-time dashboards.
 * 
 * Architecture:
 * - REST APIs for a fixed catalog of analytical operations
 * - Cache-aside Redis caching with per-operation TTLs
 * - Single-flight computation for concurrent cache misses
 * - Periodic materialized view refresh with cache invalidation
 * - WebSocket push of data_refreshed notifications
 * - Event and order ingestion (OLTP) separated from analytics reads (OLAP)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DashboardAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardAnalyticsApplication.class, args);
    }
}
