package com.dashboard.domain.service;

import com.dashboard.domain.catalog.AnalyticsOperation;
import com.dashboard.domain.catalog.AnalyticsQuery;
import com.dashboard.domain.catalog.AnalyticsQueryCatalog;
import com.dashboard.domain.catalog.CachePolicy;
import com.dashboard.domain.catalog.QueryDefinition;
import com.dashboard.domain.catalog.QueryParameters;
import com.dashboard.domain.exception.CacheUnavailableException;
import com.dashboard.domain.exception.QueryExecutionException;
import com.dashboard.domain.exception.QueryValidationException;
import com.dashboard.domain.model.QueryResult;
import com.dashboard.infrastructure.cache.CacheKeys;
import com.dashboard.infrastructure.cache.CacheStore;
import com.dashboard.infrastructure.cache.QueryResultCodec;
import com.dashboard.infrastructure.persistence.AnalyticsQueryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Cache-aside serving of catalog operations.
 * 
 * Query Flow:
 * 1. Validate parameters (before any cache or database access)
 * 2. Derive cache key from operation name and parameters
 * 3. Check cache (Redis); a hit never executes the query
 * 4. On miss, execute under the operation's timeout
 * 5. Store result with the operation's TTL (best effort)
 * 6. Return result
 * 
 * Operations whose cache policy is disabled skip steps 2, 3 and 5.
 * 
 * Concurrent misses on one key share a single in-flight computation; the
 * other callers wait for its rows (or its failure) instead of recomputing.
 * 
 * Tradeoff: Freshness vs Performance
 * - Cached data may be stale up to its TTL, or until the next view refresh
 * - Redis faults only cost latency: reads degrade to misses, writes are skipped
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheAsideQueryService {

    private final AnalyticsQueryCatalog catalog;
    private final AnalyticsQueryExecutor queryExecutor;
    private final CacheStore cacheStore;
    private final QueryResultCodec codec;
    private final Validator validator;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, CompletableFuture<List<Map<String, Object>>>> inFlight = new ConcurrentHashMap<>();

    /**
     * Resolves an operation by wire name and serves it.
     *
     * @throws com.dashboard.domain.exception.UnknownOperationException if the name is not in the catalog
     */
    public QueryResult getOrCompute(String operationName, Map<String, ?> params) {
        AnalyticsOperation operation = AnalyticsOperation.fromName(operationName);
        return getOrCompute(operation.bind(QueryParameters.of(params)));
    }

    public QueryResult getOrCompute(AnalyticsQuery query) {
        validate(query);

        QueryDefinition definition = catalog.definitionFor(query);
        CachePolicy policy = definition.getCachePolicy();
        String operation = definition.getName();

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        boolean cached = false;

        try {
            List<Map<String, Object>> rows;

            if (!policy.isEnabled()) {
                recordCacheResult(operation, "bypass");
                rows = compute(definition, query);
            } else {
                String cacheKey = CacheKeys.forQuery(query);
                Optional<List<Map<String, Object>>> hit = readCache(cacheKey);

                if (hit.isPresent()) {
                    log.debug("Cache hit for query: {}", cacheKey);
                    recordCacheResult(operation, "hit");
                    cached = true;
                    rows = hit.get();
                } else {
                    log.debug("Cache miss for query: {}", cacheKey);
                    recordCacheResult(operation, "miss");
                    rows = computeOnce(cacheKey, definition, query);
                }
            }

            return QueryResult.builder()
                    .operation(operation)
                    .rows(rows)
                    .cached(cached)
                    .queryTimeMs(System.currentTimeMillis() - startTime)
                    .build();

        } finally {
            sample.stop(Timer.builder("query.latency")
                    .tag("operation", operation)
                    .tag("cached", String.valueOf(cached))
                    .register(meterRegistry));
        }
    }

    /**
     * Number of keys with a computation currently in progress.
     */
    int inFlightCount() {
        return inFlight.size();
    }

    private void validate(AnalyticsQuery query) {
        Set<ConstraintViolation<AnalyticsQuery>> violations = validator.validate(query);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            throw new QueryValidationException(String.join("; ", messages), messages);
        }
    }

    private List<Map<String, Object>> computeOnce(String cacheKey, QueryDefinition definition, AnalyticsQuery query) {
        CompletableFuture<List<Map<String, Object>>> mine = new CompletableFuture<>();
        CompletableFuture<List<Map<String, Object>>> leader = inFlight.putIfAbsent(cacheKey, mine);

        if (leader != null) {
            log.debug("Joining in-flight computation for: {}", cacheKey);
            return await(leader);
        }

        try {
            List<Map<String, Object>> rows = compute(definition, query);
            // Entry must be cached before the in-flight future is released
            writeCache(cacheKey, rows, definition.getCachePolicy());
            mine.complete(rows);
            return rows;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(cacheKey, mine);
        }
    }

    private List<Map<String, Object>> await(CompletableFuture<List<Map<String, Object>>> leader) {
        try {
            return leader.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private List<Map<String, Object>> compute(QueryDefinition definition, AnalyticsQuery query) {
        String operation = definition.getName();
        try {
            List<Map<String, Object>> raw = queryExecutor.execute(definition, query.getParameters());
            List<Map<String, Object>> rows = transform(definition, raw);

            Counter.builder("query.executed")
                    .tag("operation", operation)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            return rows;

        } catch (RuntimeException e) {
            log.error("Error executing {} query: {}", operation, e.getMessage());

            Counter.builder("query.executed")
                    .tag("operation", operation)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            throw e;
        }
    }

    private List<Map<String, Object>> transform(QueryDefinition definition, List<Map<String, Object>> raw) {
        try {
            return definition.getResultTransformer().apply(raw);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new QueryExecutionException("Unexpected result shape for " + definition.getName(), e);
        }
    }

    private Optional<List<Map<String, Object>>> readCache(String cacheKey) {
        try {
            Optional<String> payload = cacheStore.get(cacheKey);
            if (payload.isPresent()) {
                return Optional.of(codec.decode(payload.get()));
            }
        } catch (CacheUnavailableException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", cacheKey, e.getMessage());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Undecodable cache entry for {}, treating as miss: {}", cacheKey, e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String cacheKey, List<Map<String, Object>> rows, CachePolicy policy) {
        try {
            cacheStore.set(cacheKey, codec.encode(rows), policy.getTtl());
        } catch (CacheUnavailableException | JsonProcessingException e) {
            // The fresh result is still returned; the next request recomputes
            log.warn("Cache write skipped for {}: {}", cacheKey, e.getMessage());
        }
    }

    private void recordCacheResult(String operation, String result) {
        Counter.builder("query.cache")
                .tag("operation", operation)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
