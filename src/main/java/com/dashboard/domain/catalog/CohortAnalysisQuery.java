package com.dashboard.domain.catalog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cohort retention over the trailing {@code weeks}, optionally restricted to one acquisition source.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CohortAnalysisQuery extends AnalyticsQuery {

    public static final int DEFAULT_WEEKS = 12;
    public static final Set<String> PARAMETERS = Set.of("weeks", "source");

    @Min(value = 1, message = "weeks must be between 1 and 52")
    @Max(value = 52, message = "weeks must be between 1 and 52")
    int weeks;

    @Size(min = 1, max = 100, message = "source must be between 1 and 100 characters")
    String source;

    @Override
    public AnalyticsOperation getOperation() {
        return AnalyticsOperation.COHORT_ANALYSIS;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new TreeMap<>();
        params.put("source", source);
        params.put("weeks", weeks);
        return params;
    }
}
