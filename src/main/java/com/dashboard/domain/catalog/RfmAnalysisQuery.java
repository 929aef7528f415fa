package com.dashboard.domain.catalog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recency/frequency/monetary segmentation of the top {@code limit} customers.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class RfmAnalysisQuery extends AnalyticsQuery {

    public static final int DEFAULT_LIMIT = 1000;
    public static final Set<String> PARAMETERS = Set.of("limit");

    @Min(value = 10, message = "limit must be between 10 and 10000")
    @Max(value = 10000, message = "limit must be between 10 and 10000")
    int limit;

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.RFM_ANALYSIS;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new TreeMap<>();
        params.put("limit", limit);
        return params;
    }
}
