package com.dashboard.domain.catalog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * View, cart, checkout, purchase funnel over the trailing {@code days}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class FunnelAnalysisQuery extends AnalyticsQuery {

    public static final int DEFAULT_DAYS = 7;
    public static final Set<String> PARAMETERS = Set.of("days");

    @Min(value = 1, message = "days must be between 1 and 30")
    @Max(value = 30, message = "days must be between 1 and 30")
    int days;

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.FUNNEL_ANALYSIS;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new TreeMap<>();
        params.put("days", days);
        return params;
    }
}
