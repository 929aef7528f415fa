package com.dashboard.domain.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable catalog entry: SQL template, declared parameters, cache policy and timeout of one operation.
 */
@Value
@Builder
public class QueryDefinition {

    @NonNull
    AnalyticsOperation operation;

    @NonNull
    String sql;

    @NonNull
    Set<String> parameterNames;

    @NonNull
    CachePolicy cachePolicy;

    @NonNull
    Duration timeout;

    @NonNull
    @Builder.Default
    ResultTransformer resultTransformer = ResultTransformer.IDENTITY;

    public String getName() {
        return operation.getOperationName();
    }
}
