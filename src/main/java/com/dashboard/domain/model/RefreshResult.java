package com.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one materialized view refresh cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshResult {

    private Outcome outcome;
    private Instant startedAt;
    private long durationMs;
    private int invalidatedKeys;
    private String errorMessage;

    public enum Outcome {
        SUCCESS,
        FAILED,
        // Another cycle was already running
        SKIPPED
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
