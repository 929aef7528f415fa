package com.dashboard.domain.catalog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Hourly dashboard metrics over the trailing {@code hours} window.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class DashboardMetricsQuery extends AnalyticsQuery {

    public static final int DEFAULT_HOURS = 24;
    public static final Set<String> PARAMETERS = Set.of("hours");

    // Bounded to a week so a single request cannot scan excessive history
    @Min(value = 1, message = "hours must be between 1 and 168")
    @Max(value = 168, message = "hours must be between 1 and 168")
    int hours;

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.DASHBOARD_METRICS;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new TreeMap<>();
        params.put("hours", hours);
        return params;
    }
}
