package com.dashboard.domain.service;

import com.dashboard.config.DashboardProperties;
import com.dashboard.domain.exception.CacheUnavailableException;
import com.dashboard.domain.model.RealtimeMetrics;
import com.dashboard.infrastructure.cache.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read access to streaming counters kept in the cache by ingestion.
 * 
 * Counters are best-effort telemetry: a missing, malformed or unreadable
 * counter reads as zero rather than failing the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RealtimeCounterService {

    public static final String ACTIVE_USERS_KEY = "active_users:now";
    public static final String ORDERS_LAST_HOUR_KEY = "orders:last_hour";
    public static final String REVENUE_LAST_HOUR_KEY = "revenue:last_hour";
    public static final String EVENTS_PER_SECOND_KEY = "events:per_second";

    private final CacheStore cacheStore;
    private final DashboardProperties properties;

    public RealtimeMetrics currentMetrics() {
        return RealtimeMetrics.builder()
                .activeUsersNow(readDecimal(ACTIVE_USERS_KEY).longValue())
                .ordersLastHour(readDecimal(ORDERS_LAST_HOUR_KEY).longValue())
                .revenueLastHour(readDecimal(REVENUE_LAST_HOUR_KEY))
                .eventsPerSecond(readDecimal(EVENTS_PER_SECOND_KEY).doubleValue())
                .build();
    }

    /**
     * Counts one ingested order in the current window.
     * 
     * The window expiry is set by the increment that creates the counter.
     */
    public void recordOrder() {
        try {
            long count = cacheStore.increment(ORDERS_LAST_HOUR_KEY, 1);
            if (count == 1) {
                cacheStore.expire(ORDERS_LAST_HOUR_KEY, properties.getRealtime().getCounterWindow());
            }
        } catch (CacheUnavailableException e) {
            log.warn("Order counter not updated: {}", e.getMessage());
        }
    }

    private BigDecimal readDecimal(String key) {
        Optional<String> value;
        try {
            value = cacheStore.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("Counter {} unavailable: {}", key, e.getMessage());
            return BigDecimal.ZERO;
        }
        if (value.isEmpty() || value.get().isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value.get().trim());
        } catch (NumberFormatException e) {
            log.debug("Counter {} holds a non-numeric value: {}", key, value.get());
            return BigDecimal.ZERO;
        }
    }
}
