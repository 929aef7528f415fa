package com.dashboard.infrastructure.cache;

import com.dashboard.domain.exception.CacheUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheStore.
 * 
 * Circuit breaker behavior needs the Spring proxy and is not covered here;
 * these tests check fault translation and command usage.
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheStore cacheStore;

    @BeforeEach
    void setUp() {
        cacheStore = new RedisCacheStore(redisTemplate);
    }

    @Test
    void testGet_Hit() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("dashboard_metrics:24")).thenReturn("[]");

        // When
        Optional<String> result = cacheStore.get("dashboard_metrics:24");

        // Then
        assertEquals(Optional.of("[]"), result);
    }

    @Test
    void testGet_Miss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertTrue(cacheStore.get("dashboard_metrics:24").isEmpty());
    }

    @Test
    void testGet_ConnectionFailureTranslated() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("Connection refused"));

        // When
        CacheUnavailableException e = assertThrows(CacheUnavailableException.class,
                () -> cacheStore.get("dashboard_metrics:24"));

        // Then
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void testSet_WritesWithTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        cacheStore.set("cohort_analysis:-:12", "[]", Duration.ofMinutes(10));

        // Then
        verify(valueOperations).set("cohort_analysis:-:12", "[]", Duration.ofMinutes(10));
    }

    @Test
    void testSet_RejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> cacheStore.set("k", "v", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> cacheStore.set("k", "v", null));
        verifyNoInteractions(redisTemplate);
    }

    @Test
    void testSet_FailureTranslated() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("Connection reset"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        // When / Then
        assertThrows(CacheUnavailableException.class, () -> cacheStore.set("k", "v", Duration.ofSeconds(5)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDeleteByPrefix_DeletesEachScannedKey() {
        // Given
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenReturn(List.of("dashboard_metrics:24", "dashboard_metrics:48", "dashboard_metrics:72"));
        when(redisTemplate.delete("dashboard_metrics:24")).thenReturn(true);
        when(redisTemplate.delete("dashboard_metrics:48")).thenReturn(true);
        // Expired between SCAN and DEL
        when(redisTemplate.delete("dashboard_metrics:72")).thenReturn(false);

        // When
        int deleted = cacheStore.deleteByPrefix("dashboard_metrics:");

        // Then
        assertEquals(2, deleted);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDeleteByPrefix_ScanFailureTranslated() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertThrows(CacheUnavailableException.class, () -> cacheStore.deleteByPrefix("cohort_analysis:"));
    }

    @Test
    void testIncrement() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("orders:last_hour", 1L)).thenReturn(5L);

        // When / Then
        assertEquals(5L, cacheStore.increment("orders:last_hour", 1));
    }

    @Test
    void testDelete() {
        when(redisTemplate.delete("dashboard_metrics:24")).thenReturn(true);
        when(redisTemplate.delete("dashboard_metrics:48")).thenReturn(false);

        assertTrue(cacheStore.delete("dashboard_metrics:24"));
        assertFalse(cacheStore.delete("dashboard_metrics:48"));
    }
}
