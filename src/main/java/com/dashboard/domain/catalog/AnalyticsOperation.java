package com.dashboard.domain.catalog;

import com.dashboard.domain.exception.UnknownOperationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Allowlist of analytical operations the serving layer accepts.
 * 
 * Each constant knows how to bind loosely typed request parameters into its
 * own strongly typed query object. Nothing outside this enum can reach query
 * execution, so free-form SQL from callers is impossible by construction.
 */
public enum AnalyticsOperation {

    DASHBOARD_METRICS("dashboard_metrics") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(DashboardMetricsQuery.PARAMETERS);
            return new DashboardMetricsQuery(params.getInt("hours", DashboardMetricsQuery.DEFAULT_HOURS));
        }
    },

    COHORT_ANALYSIS("cohort_analysis") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(CohortAnalysisQuery.PARAMETERS);
            return new CohortAnalysisQuery(
                    params.getInt("weeks", CohortAnalysisQuery.DEFAULT_WEEKS),
                    params.getString("source"));
        }
    },

    FUNNEL_ANALYSIS("funnel_analysis") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(FunnelAnalysisQuery.PARAMETERS);
            return new FunnelAnalysisQuery(params.getInt("days", FunnelAnalysisQuery.DEFAULT_DAYS));
        }
    },

    ROLLING_REVENUE("rolling_revenue") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(RollingRevenueQuery.PARAMETERS);
            return new RollingRevenueQuery(params.getInt("days", RollingRevenueQuery.DEFAULT_DAYS));
        }
    },

    RFM_ANALYSIS("rfm_analysis") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(RfmAnalysisQuery.PARAMETERS);
            return new RfmAnalysisQuery(params.getInt("limit", RfmAnalysisQuery.DEFAULT_LIMIT));
        }
    },

    ANOMALY_DETECTION("anomaly_detection") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(AnomalyDetectionQuery.PARAMETERS);
            return new AnomalyDetectionQuery(params.getInt("days", AnomalyDetectionQuery.DEFAULT_DAYS));
        }
    },

    TOP_PRODUCTS("top_products") {
        @Override
        public AnalyticsQuery bind(QueryParameters params) {
            params.rejectUnknown(TopProductsQuery.PARAMETERS);
            return new TopProductsQuery();
        }
    };

    private static final Map<String, AnalyticsOperation> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(AnalyticsOperation::getOperationName, Function.identity())));

    private final String operationName;

    AnalyticsOperation(String operationName) {
        this.operationName = operationName;
    }

    /**
     * Wire name, also used as the cache key prefix and the SQL resource name.
     */
    public String getOperationName() {
        return operationName;
    }

    /**
     * Binds request parameters to this operation's typed query.
     * 
     * Coerces types and applies defaults; range checks happen later through bean validation.
     */
    public abstract AnalyticsQuery bind(QueryParameters params);

    public static AnalyticsOperation fromName(String operationName) {
        AnalyticsOperation operation = operationName == null ? null : BY_NAME.get(operationName);
        if (operation == null) {
            throw new UnknownOperationException(operationName);
        }
        return operation;
    }
}
