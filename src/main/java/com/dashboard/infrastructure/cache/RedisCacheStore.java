package com.dashboard.infrastructure.cache;

import com.dashboard.domain.exception.CacheUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed cache store.
 * 
 * Every Redis fault is rethrown as CacheUnavailableException so the circuit
 * breaker can count it. While the breaker is open calls fail fast with the same
 * exception instead of waiting on an unreachable Redis.
 * 
 * Prefix deletion uses SCAN (never KEYS) followed by one DEL per key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private static final String BREAKER = "redis";
    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "getFallback")
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis GET failed for key " + key, e);
        }
    }

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "setFallback")
    public void set(String key, String payload, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive for key " + key);
        }
        try {
            redisTemplate.opsForValue().set(key, payload, ttl);
            log.debug("Cached key: {} (TTL: {}s)", key, ttl.toSeconds());
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis SET failed for key " + key, e);
        }
    }

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "deleteFallback")
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis DEL failed for key " + key, e);
        }
    }

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "deleteByPrefixFallback")
    public int deleteByPrefix(String prefix) {
        try {
            List<String> keys = redisTemplate.execute((RedisCallback<List<String>>) connection -> {
                List<String> found = new ArrayList<>();
                ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
                try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                    while (cursor.hasNext()) {
                        found.add(new String(cursor.next(), StandardCharsets.UTF_8));
                    }
                }
                return found;
            });

            int deleted = 0;
            if (keys != null) {
                for (String key : keys) {
                    if (Boolean.TRUE.equals(redisTemplate.delete(key))) {
                        deleted++;
                    }
                }
            }
            log.debug("Deleted {} keys with prefix: {}", deleted, prefix);
            return deleted;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis prefix delete failed for " + prefix, e);
        }
    }

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "incrementFallback")
    public long increment(String key, long amount) {
        try {
            Long value = redisTemplate.opsForValue().increment(key, amount);
            return value == null ? 0L : value;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis INCRBY failed for key " + key, e);
        }
    }

    @Override
    @CircuitBreaker(name = BREAKER, fallbackMethod = "expireFallback")
    public void expire(String key, Duration ttl) {
        try {
            redisTemplate.expire(key, ttl);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis EXPIRE failed for key " + key, e);
        }
    }

    // Fallback methods (circuit breaker open)

    private Optional<String> getFallback(String key, CallNotPermittedException e) {
        throw circuitOpen("GET", e);
    }

    private void setFallback(String key, String payload, Duration ttl, CallNotPermittedException e) {
        throw circuitOpen("SET", e);
    }

    private boolean deleteFallback(String key, CallNotPermittedException e) {
        throw circuitOpen("DEL", e);
    }

    private int deleteByPrefixFallback(String prefix, CallNotPermittedException e) {
        throw circuitOpen("SCAN", e);
    }

    private long incrementFallback(String key, long amount, CallNotPermittedException e) {
        throw circuitOpen("INCRBY", e);
    }

    private void expireFallback(String key, Duration ttl, CallNotPermittedException e) {
        throw circuitOpen("EXPIRE", e);
    }

    private CacheUnavailableException circuitOpen(String command, CallNotPermittedException e) {
        log.warn("Redis circuit breaker open, rejecting {}", command);
        return new CacheUnavailableException("Redis circuit breaker open", e);
    }
}
