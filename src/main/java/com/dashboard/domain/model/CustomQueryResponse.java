package com.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomQueryResponse {

    @JsonProperty("query_type")
    private String queryType;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @JsonProperty("rows_count")
    private int rowsCount;

    private boolean cached;

    private List<Map<String, Object>> data;

    public static CustomQueryResponse from(QueryResult result) {
        return CustomQueryResponse.builder()
                .queryType(result.getOperation())
                .executionTimeMs(result.getQueryTimeMs())
                .rowsCount(result.getRowCount())
                .cached(result.isCached())
                .data(result.getRows())
                .build();
    }
}
