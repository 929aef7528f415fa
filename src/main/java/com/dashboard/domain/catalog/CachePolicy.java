package com.dashboard.domain.catalog;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Whether results of an operation are cached, and for how long.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CachePolicy {

    private static final CachePolicy DISABLED = new CachePolicy(false, null, false);

    boolean enabled;
    Duration ttl;

    /**
     * Entries are derived from materialized views and must be dropped when the views are refreshed.
     */
    boolean invalidatedOnRefresh;

    public static CachePolicy cached(Duration ttl) {
        return new CachePolicy(true, ttl, false);
    }

    public static CachePolicy cachedUntilRefresh(Duration ttl) {
        return new CachePolicy(true, ttl, true);
    }

    public static CachePolicy disabled() {
        return DISABLED;
    }
}
