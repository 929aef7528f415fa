package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Streaming counters read from the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeMetrics {

    private long activeUsersNow;
    private long ordersLastHour;
    private BigDecimal revenueLastHour;
    private double eventsPerSecond;
}
