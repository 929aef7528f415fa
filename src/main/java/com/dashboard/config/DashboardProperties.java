package com.dashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Application settings bound from the {@code app.*} block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "app")
public class DashboardProperties {

    private final Query query = new Query();
    private final Refresh refresh = new Refresh();
    private final Realtime realtime = new Realtime();

    @Data
    public static class Query {

        /**
         * Statement timeout for operations without their own override.
         */
        private Duration defaultTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Refresh {

        private boolean enabled = true;

        /**
         * Delay between the end of one materialized view refresh and the start of the next.
         */
        private Duration period = Duration.ofMinutes(5);

        private Duration initialDelay = Duration.ofMinutes(5);

        /**
         * Upper bound for one recomputation of the materialized views.
         */
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Realtime {

        /**
         * Expiry applied to the window of counters incremented by ingestion.
         */
        private Duration counterWindow = Duration.ofHours(1);
    }
}
