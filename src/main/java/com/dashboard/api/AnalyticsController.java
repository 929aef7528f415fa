package com.dashboard.api;

import com.dashboard.domain.catalog.AnomalyDetectionQuery;
import com.dashboard.domain.catalog.CohortAnalysisQuery;
import com.dashboard.domain.catalog.DashboardMetricsQuery;
import com.dashboard.domain.catalog.FunnelAnalysisQuery;
import com.dashboard.domain.catalog.RfmAnalysisQuery;
import com.dashboard.domain.catalog.RollingRevenueQuery;
import com.dashboard.domain.catalog.TopProductsQuery;
import com.dashboard.domain.model.CustomQueryRequest;
import com.dashboard.domain.model.CustomQueryResponse;
import com.dashboard.domain.model.QueryResult;
import com.dashboard.domain.model.RealtimeMetrics;
import com.dashboard.domain.service.CacheAsideQueryService;
import com.dashboard.domain.service.RealtimeCounterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for dashboard analytics.
 * 
 * Endpoints:
 * - GET /api/v1/analytics/dashboard - Hourly metrics (cached)
 * - GET /api/v1/analytics/cohorts - Retention by cohort (cached)
 * - GET /api/v1/analytics/funnel - Conversion funnel (cached)
 * - GET /api/v1/analytics/revenue - Rolling revenue
 * - GET /api/v1/analytics/rfm - Customer segments
 * - GET /api/v1/analytics/anomalies - Hourly event volume anomalies
 * - GET /api/v1/analytics/top-products - Best sellers, last 30 days
 * - POST /api/v1/analytics/custom-query - Any catalog operation by name
 * - GET /api/v1/analytics/realtime - Streaming counters
 * 
 * Parameter bounds are enforced by the query service; out-of-range values
 * answer 400 before the cache or database is touched.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final CacheAsideQueryService queryService;
    private final RealtimeCounterService realtimeCounterService;

    /**
     * GET /api/v1/analytics/dashboard?hours=24
     */
    @GetMapping("/dashboard")
    public ResponseEntity<QueryResult> dashboard(
            @RequestParam(defaultValue = "" + DashboardMetricsQuery.DEFAULT_HOURS) int hours) {
        log.info("Dashboard metrics: hours={}", hours);
        return ResponseEntity.ok(queryService.getOrCompute(new DashboardMetricsQuery(hours)));
    }

    /**
     * GET /api/v1/analytics/cohorts?weeks=12&source=organic
     */
    @GetMapping("/cohorts")
    public ResponseEntity<QueryResult> cohorts(
            @RequestParam(defaultValue = "" + CohortAnalysisQuery.DEFAULT_WEEKS) int weeks,
            @RequestParam(required = false) String source) {
        log.info("Cohort analysis: weeks={}, source={}", weeks, source);
        String normalizedSource = source == null || source.isBlank() ? null : source;
        return ResponseEntity.ok(queryService.getOrCompute(new CohortAnalysisQuery(weeks, normalizedSource)));
    }

    @GetMapping("/funnel")
    public ResponseEntity<QueryResult> funnel(
            @RequestParam(defaultValue = "" + FunnelAnalysisQuery.DEFAULT_DAYS) int days) {
        log.info("Funnel analysis: days={}", days);
        return ResponseEntity.ok(queryService.getOrCompute(new FunnelAnalysisQuery(days)));
    }

    /**
     * Never cached.
     */
    @GetMapping("/revenue")
    public ResponseEntity<QueryResult> revenue(
            @RequestParam(defaultValue = "" + RollingRevenueQuery.DEFAULT_DAYS) int days) {
        log.info("Rolling revenue: days={}", days);
        return ResponseEntity.ok(queryService.getOrCompute(new RollingRevenueQuery(days)));
    }

    @GetMapping("/rfm")
    public ResponseEntity<QueryResult> rfm(
            @RequestParam(defaultValue = "" + RfmAnalysisQuery.DEFAULT_LIMIT) int limit) {
        log.info("RFM analysis: limit={}", limit);
        return ResponseEntity.ok(queryService.getOrCompute(new RfmAnalysisQuery(limit)));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<QueryResult> anomalies(
            @RequestParam(defaultValue = "" + AnomalyDetectionQuery.DEFAULT_DAYS) int days) {
        log.info("Anomaly detection: days={}", days);
        return ResponseEntity.ok(queryService.getOrCompute(new AnomalyDetectionQuery(days)));
    }

    @GetMapping("/top-products")
    public ResponseEntity<QueryResult> topProducts() {
        return ResponseEntity.ok(queryService.getOrCompute(new TopProductsQuery()));
    }

    /**
     * Run a catalog operation by name.
     * 
     * POST /api/v1/analytics/custom-query
     * 
     * Request body:
     * {
     *   "queryType": "dashboard_metrics",
     *   "params": { "hours": 24 }
     * }
     * 
     * Unknown operation names answer 404, unknown or invalid params 400.
     */
    @PostMapping("/custom-query")
    public ResponseEntity<CustomQueryResponse> customQuery(@Valid @RequestBody CustomQueryRequest request) {
        log.info("Custom query: queryType={}, params={}", request.getQueryType(), request.getParams());
        QueryResult result = queryService.getOrCompute(request.getQueryType(), request.getParams());
        return ResponseEntity.ok(CustomQueryResponse.from(result));
    }

    @GetMapping("/realtime")
    public ResponseEntity<RealtimeMetrics> realtime() {
        return ResponseEntity.ok(realtimeCounterService.currentMetrics());
    }
}
