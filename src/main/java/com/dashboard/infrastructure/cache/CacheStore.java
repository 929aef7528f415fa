package com.dashboard.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-key expiry and atomic counters.
 * 
 * Only single-key operations are offered; there are no multi-key transactions.
 * Backend faults surface as {@link com.dashboard.domain.exception.CacheUnavailableException},
 * which callers on the serving path absorb (miss on read, no-op on write).
 */
public interface CacheStore {

    /**
     * @return the stored payload, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Stores a payload that expires after {@code ttl}.
     *
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    void set(String key, String payload, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Deletes every key starting with {@code prefix}, one key at a time.
     *
     * @return number of entries removed
     */
    int deleteByPrefix(String prefix);

    /**
     * Atomically adds {@code amount} to an integer counter, creating it at zero if absent.
     *
     * @return the counter value after the increment
     */
    long increment(String key, long amount);

    void expire(String key, Duration ttl);
}
