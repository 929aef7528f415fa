package com.dashboard.domain.service;

import com.dashboard.domain.model.EventIngestRequest;
import com.dashboard.domain.model.IngestResponse;
import com.dashboard.domain.model.OrderIngestRequest;
import com.dashboard.infrastructure.persistence.entity.EventEntity;
import com.dashboard.infrastructure.persistence.entity.OrderEntity;
import com.dashboard.infrastructure.persistence.repository.EventRepository;
import com.dashboard.infrastructure.persistence.repository.OrderRepository;
import com.dashboard.infrastructure.persistence.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;

/**
 * Write path for raw events and orders (OLTP side).
 * 
 * Ingested rows reach the dashboards once the next view refresh picks them up;
 * only the realtime order counter moves immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final UserRepository userRepository;
    private final EventRepository eventRepository;
    private final OrderRepository orderRepository;
    private final RealtimeCounterService realtimeCounterService;

    @Transactional
    public IngestResponse ingestEvent(EventIngestRequest request) {
        if (request.getUserId() != null) {
            int created = userRepository.insertIfAbsent(request.getUserId(), placeholderEmail(request.getUserId()));
            if (created > 0) {
                log.debug("Created placeholder user {}", request.getUserId());
            }
        }

        EventEntity event = eventRepository.save(EventEntity.builder()
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .eventType(request.getEventType())
                .pagePath(request.getPagePath())
                .metadata(request.getMetadata() != null ? request.getMetadata() : new HashMap<>())
                .build());

        log.debug("Ingested {} event {} for session {}", event.getEventType(), event.getId(), event.getSessionId());
        return new IngestResponse(event.getId(), event.getCreatedAt());
    }

    @Transactional
    public IngestResponse ingestOrder(OrderIngestRequest request) {
        Instant now = Instant.now();
        OrderEntity order = orderRepository.save(OrderEntity.builder()
                .userId(request.getUserId())
                .orderNumber(request.getOrderNumber())
                .status(OrderEntity.STATUS_COMPLETED)
                .amount(request.getAmount())
                .currency(request.getCurrency() != null ? request.getCurrency() : "USD")
                .itemsCount(request.getItemsCount())
                .metadata(request.getMetadata() != null ? request.getMetadata() : new HashMap<>())
                .createdAt(now)
                .completedAt(now)
                .build());

        log.info("Ingested order {} ({} {})", order.getOrderNumber(), order.getAmount(), order.getCurrency());
        afterCommit(realtimeCounterService::recordOrder);
        return new IngestResponse(order.getId(), order.getCreatedAt());
    }

    static String placeholderEmail(UUID userId) {
        return "user_" + userId + "@example.com";
    }

    // Counters must not count rows that are rolled back
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
