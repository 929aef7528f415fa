package com.dashboard.domain.catalog;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Top 20 products by completed-order revenue over the last 30 days.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class TopProductsQuery extends AnalyticsQuery {

    public static final Set<String> PARAMETERS = Set.of();

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.TOP_PRODUCTS;
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of();
    }
}
