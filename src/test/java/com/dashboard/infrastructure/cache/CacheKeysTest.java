package com.dashboard.infrastructure.cache;

import com.dashboard.domain.catalog.AnalyticsOperation;
import com.dashboard.domain.catalog.CohortAnalysisQuery;
import com.dashboard.domain.catalog.DashboardMetricsQuery;
import com.dashboard.domain.catalog.TopProductsQuery;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    void testForQuery_DashboardDefault() {
        assertEquals("dashboard_metrics:24", CacheKeys.forQuery(new DashboardMetricsQuery(24)));
    }

    @Test
    void testForQuery_ValuesOrderedByParameterName() {
        assertEquals("cohort_analysis:s=organic:8", CacheKeys.forQuery(new CohortAnalysisQuery(8, "organic")));
        assertEquals("cohort_analysis:-:12", CacheKeys.forQuery(new CohortAnalysisQuery(12, null)));
    }

    @Test
    void testForQuery_AbsentSourceDistinctFromAnyValue() {
        String unfiltered = CacheKeys.forQuery(new CohortAnalysisQuery(12, null));

        assertNotEquals(unfiltered, CacheKeys.forQuery(new CohortAnalysisQuery(12, "all")));
        assertNotEquals(unfiltered, CacheKeys.forQuery(new CohortAnalysisQuery(12, "-")));
        assertEquals("cohort_analysis:s=-:12", CacheKeys.forQuery(new CohortAnalysisQuery(12, "-")));
    }

    @Test
    void testForQuery_NoParameters() {
        assertEquals("top_products", CacheKeys.forQuery(new TopProductsQuery()));
    }

    @Test
    void testPrefixOf_MatchesEveryVariant() {
        String prefix = CacheKeys.prefixOf(AnalyticsOperation.DASHBOARD_METRICS);

        assertTrue(CacheKeys.forQuery(new DashboardMetricsQuery(168)).startsWith(prefix));
        assertFalse("dashboard_metrics_v2:24".startsWith(prefix));
    }
}
