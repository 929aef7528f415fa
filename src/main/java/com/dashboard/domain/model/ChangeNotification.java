package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lightweight message pushed to connected dashboards when new data may be available.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeNotification {

    public static final String DATA_REFRESHED = "data_refreshed";

    private String type;
    private Instant timestamp;
    private String message;

    public static ChangeNotification dataRefreshed(Instant timestamp) {
        return new ChangeNotification(DATA_REFRESHED, timestamp, "Materialized views refreshed");
    }
}
