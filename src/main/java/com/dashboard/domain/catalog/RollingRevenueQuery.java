package com.dashboard.domain.catalog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Daily revenue with 7-day rolling average, growth and cumulative totals.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class RollingRevenueQuery extends AnalyticsQuery {

    public static final int DEFAULT_DAYS = 30;
    public static final Set<String> PARAMETERS = Set.of("days");

    @Min(value = 7, message = "days must be between 7 and 365")
    @Max(value = 365, message = "days must be between 7 and 365")
    int days;

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.ROLLING_REVENUE;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new TreeMap<>();
        params.put("days", days);
        return params;
    }
}
