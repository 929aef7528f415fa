package com.dashboard.domain.service;

import com.dashboard.config.DashboardProperties;
import com.dashboard.domain.catalog.AnalyticsQueryCatalog;
import com.dashboard.domain.catalog.QueryDefinition;
import com.dashboard.domain.exception.CacheUnavailableException;
import com.dashboard.domain.exception.RefreshFailedException;
import com.dashboard.domain.model.ChangeNotification;
import com.dashboard.domain.model.RefreshResult;
import com.dashboard.infrastructure.cache.CacheKeys;
import com.dashboard.infrastructure.cache.CacheStore;
import com.dashboard.infrastructure.persistence.AggregateRefresher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic recomputation of materialized aggregates.
 * 
 * Cycle:
 * 1. Recompute aggregates (refresh_dashboard_views)
 * 2. Delete every cached variant of operations that read those aggregates
 * 3. Broadcast a data_refreshed notification
 * 
 * A failure in step 1 leaves the cache untouched; entries expire through their
 * TTL, so staleness is bounded by one TTL plus one refresh period. A failed
 * cycle is logged and the next tick runs unconditionally.
 * 
 * The timer thread is owned here and started/stopped with the application
 * context. The manual trigger calls {@link #refreshNow()}, the same code path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshCoordinator implements SmartLifecycle {

    public enum State {
        IDLE,
        REFRESHING
    }

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final AggregateRefresher aggregateRefresher;
    private final CacheStore cacheStore;
    private final AnalyticsQueryCatalog catalog;
    private final ChangeNotifier changeNotifier;
    private final DashboardProperties properties;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile RefreshResult lastResult;
    private volatile boolean running;
    private ScheduledExecutorService scheduler;

    /**
     * Runs one refresh cycle on the calling thread.
     * 
     * Returns SKIPPED without doing anything if another cycle is in progress.
     */
    public RefreshResult refreshNow() {
        if (!state.compareAndSet(State.IDLE, State.REFRESHING)) {
            log.info("Refresh already in progress, skipping");
            return RefreshResult.builder()
                    .outcome(RefreshResult.Outcome.SKIPPED)
                    .startedAt(Instant.now())
                    .build();
        }

        Instant startedAt = Instant.now();
        long startTime = System.currentTimeMillis();
        RefreshResult result;

        try {
            recomputeAggregates();
            int invalidated = invalidateDependents();
            changeNotifier.broadcast(ChangeNotification.dataRefreshed(Instant.now()));

            result = RefreshResult.builder()
                    .outcome(RefreshResult.Outcome.SUCCESS)
                    .startedAt(startedAt)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .invalidatedKeys(invalidated)
                    .build();
            log.info("Refresh completed: {} cache entries invalidated in {} ms",
                    invalidated, result.getDurationMs());

        } catch (RefreshFailedException e) {
            log.error("Refresh failed, cached entries left to expire: {}", e.getMessage(), e);
            result = RefreshResult.builder()
                    .outcome(RefreshResult.Outcome.FAILED)
                    .startedAt(startedAt)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .errorMessage(e.getMessage())
                    .build();
        } finally {
            state.set(State.IDLE);
        }

        lastResult = result;
        return result;
    }

    public State getState() {
        return state.get();
    }

    public RefreshResult getLastResult() {
        return lastResult;
    }

    private void recomputeAggregates() {
        try {
            aggregateRefresher.refreshAggregates();
        } catch (RuntimeException e) {
            throw new RefreshFailedException("Aggregate recomputation failed: " + e.getMessage(), e);
        }
    }

    private int invalidateDependents() {
        int invalidated = 0;
        for (QueryDefinition definition : catalog.refreshDependents()) {
            String prefix = CacheKeys.prefixOf(definition.getOperation());
            try {
                invalidated += cacheStore.deleteByPrefix(prefix);
            } catch (CacheUnavailableException e) {
                throw new RefreshFailedException("Cache invalidation failed for " + prefix + "*", e);
            }
        }
        return invalidated;
    }

    private void runScheduledCycle() {
        // An exception escaping here would cancel all further executions
        try {
            refreshNow();
        } catch (RuntimeException e) {
            log.error("Unexpected error in periodic refresh: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        DashboardProperties.Refresh config = properties.getRefresh();
        if (config.isEnabled()) {
            if (config.getPeriod().isZero() || config.getPeriod().isNegative()) {
                throw new IllegalStateException("app.refresh.period must be positive");
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "refresh-coordinator");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::runScheduledCycle,
                    config.getInitialDelay().toMillis(), config.getPeriod().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Periodic refresh scheduled every {}s", config.getPeriod().toSeconds());
        } else {
            log.info("Periodic refresh disabled");
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh thread did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Periodic refresh stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
