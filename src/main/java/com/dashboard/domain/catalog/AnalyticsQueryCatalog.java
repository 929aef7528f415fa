package com.dashboard.domain.catalog;

import com.dashboard.config.DashboardProperties;
import com.dashboard.domain.analysis.FunnelCalculator;
import com.dashboard.domain.analysis.RfmSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static registry of every analytical operation the service will execute.
 * 
 * Operation → (SQL template, parameters, cache policy, timeout):
 * - dashboard_metrics: cached 5 min, dropped on view refresh
 * - cohort_analysis:   cached 10 min, dropped on view refresh, 10s timeout
 * - funnel_analysis:   cached 5 min
 * - rolling_revenue:   never cached (freshness over latency)
 * - rfm_analysis:      never cached (parameter space too large), 15s timeout
 * - anomaly_detection, top_products: never cached, 10s timeout
 * 
 * Definitions are validated once at construction. A template that references a
 * parameter its operation does not declare fails startup instead of reaching
 * the database.
 */
@Slf4j
@Component
public class AnalyticsQueryCatalog {

    private final Map<AnalyticsOperation, QueryDefinition> definitions;

    @Autowired
    public AnalyticsQueryCatalog(DashboardProperties properties) {
        this(defaultDefinitions(properties.getQuery().getDefaultTimeout()));
    }

    public AnalyticsQueryCatalog(Collection<QueryDefinition> definitions) {
        Map<AnalyticsOperation, QueryDefinition> byOperation = new EnumMap<>(AnalyticsOperation.class);
        for (QueryDefinition definition : definitions) {
            validate(definition);
            if (byOperation.put(definition.getOperation(), definition) != null) {
                throw new IllegalStateException("Duplicate catalog entry for " + definition.getName());
            }
        }
        this.definitions = Collections.unmodifiableMap(byOperation);
        log.info("Analytics catalog loaded with {} operations", byOperation.size());
    }

    public QueryDefinition definitionFor(AnalyticsOperation operation) {
        QueryDefinition definition = definitions.get(operation);
        if (definition == null) {
            throw new IllegalStateException("No catalog entry for " + operation.getOperationName());
        }
        return definition;
    }

    public QueryDefinition definitionFor(AnalyticsQuery query) {
        return definitionFor(query.getOperation());
    }

    public Collection<QueryDefinition> definitions() {
        return definitions.values();
    }

    /**
     * Cached operations whose entries go stale when materialized aggregates are recomputed.
     */
    public List<QueryDefinition> refreshDependents() {
        return definitions.values().stream()
                .filter(definition -> definition.getCachePolicy().isEnabled())
                .filter(definition -> definition.getCachePolicy().isInvalidatedOnRefresh())
                .collect(Collectors.toList());
    }

    private static void validate(QueryDefinition definition) {
        String name = definition.getName();
        Set<String> referenced = SqlTemplates.parameterNames(definition.getSql());

        Set<String> undeclared = new HashSet<>(referenced);
        undeclared.removeAll(definition.getParameterNames());
        if (!undeclared.isEmpty()) {
            throw new IllegalStateException("Template for " + name + " references undeclared parameters " + undeclared);
        }

        Set<String> unused = new HashSet<>(definition.getParameterNames());
        unused.removeAll(referenced);
        if (!unused.isEmpty()) {
            throw new IllegalStateException("Template for " + name + " never binds declared parameters " + unused);
        }

        if (definition.getTimeout().isZero() || definition.getTimeout().isNegative()) {
            throw new IllegalStateException("Timeout for " + name + " must be positive");
        }

        CachePolicy policy = definition.getCachePolicy();
        if (policy.isEnabled() && (policy.getTtl() == null || policy.getTtl().isZero() || policy.getTtl().isNegative())) {
            throw new IllegalStateException("Cache TTL for " + name + " must be positive");
        }
    }

    private static List<QueryDefinition> defaultDefinitions(Duration defaultTimeout) {
        return List.of(
                define(AnalyticsOperation.DASHBOARD_METRICS, DashboardMetricsQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.cachedUntilRefresh(Duration.ofMinutes(5)))
                        .timeout(defaultTimeout)
                        .build(),
                define(AnalyticsOperation.COHORT_ANALYSIS, CohortAnalysisQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.cachedUntilRefresh(Duration.ofMinutes(10)))
                        .timeout(Duration.ofSeconds(10))
                        .build(),
                define(AnalyticsOperation.FUNNEL_ANALYSIS, FunnelAnalysisQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.cached(Duration.ofMinutes(5)))
                        .timeout(defaultTimeout)
                        .resultTransformer(FunnelCalculator::calculate)
                        .build(),
                define(AnalyticsOperation.ROLLING_REVENUE, RollingRevenueQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.disabled())
                        .timeout(defaultTimeout)
                        .build(),
                define(AnalyticsOperation.RFM_ANALYSIS, RfmAnalysisQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.disabled())
                        .timeout(Duration.ofSeconds(15))
                        .resultTransformer(RfmSegment::annotate)
                        .build(),
                define(AnalyticsOperation.ANOMALY_DETECTION, AnomalyDetectionQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.disabled())
                        .timeout(Duration.ofSeconds(10))
                        .build(),
                define(AnalyticsOperation.TOP_PRODUCTS, TopProductsQuery.PARAMETERS)
                        .cachePolicy(CachePolicy.disabled())
                        .timeout(Duration.ofSeconds(10))
                        .build()
        );
    }

    private static QueryDefinition.QueryDefinitionBuilder define(AnalyticsOperation operation, Set<String> parameters) {
        return QueryDefinition.builder()
                .operation(operation)
                .sql(SqlTemplates.load(operation))
                .parameterNames(parameters);
    }
}
