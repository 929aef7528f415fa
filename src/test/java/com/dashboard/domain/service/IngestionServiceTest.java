package com.dashboard.domain.service;

import com.dashboard.domain.model.EventIngestRequest;
import com.dashboard.domain.model.IngestResponse;
import com.dashboard.domain.model.OrderIngestRequest;
import com.dashboard.infrastructure.persistence.entity.EventEntity;
import com.dashboard.infrastructure.persistence.entity.OrderEntity;
import com.dashboard.infrastructure.persistence.repository.EventRepository;
import com.dashboard.infrastructure.persistence.repository.OrderRepository;
import com.dashboard.infrastructure.persistence.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private EventRepository eventRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private RealtimeCounterService realtimeCounterService;

    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new IngestionService(userRepository, eventRepository, orderRepository, realtimeCounterService);
    }

    @Test
    void testIngestEvent_CreatesMissingUser() {
        // Given
        UUID userId = UUID.randomUUID();
        EventIngestRequest request = EventIngestRequest.builder()
                .userId(userId)
                .sessionId(UUID.randomUUID())
                .eventType("page_view")
                .pagePath("/products/42")
                .build();
        when(userRepository.insertIfAbsent(eq(userId), anyString())).thenReturn(1);
        when(eventRepository.save(any(EventEntity.class))).thenAnswer(invocation -> persisted(invocation.getArgument(0)));

        // When
        IngestResponse response = ingestionService.ingestEvent(request);

        // Then
        verify(userRepository).insertIfAbsent(userId, "user_" + userId + "@example.com");
        assertNotNull(response.getId());
        assertNotNull(response.getCreatedAt());
    }

    @Test
    void testIngestEvent_AnonymousSkipsUserUpsert() {
        // Given
        EventIngestRequest request = EventIngestRequest.builder()
                .sessionId(UUID.randomUUID())
                .eventType("page_view")
                .metadata(null)
                .build();
        when(eventRepository.save(any(EventEntity.class))).thenAnswer(invocation -> persisted(invocation.getArgument(0)));

        // When
        ingestionService.ingestEvent(request);

        // Then
        verifyNoInteractions(userRepository);
        ArgumentCaptor<EventEntity> saved = ArgumentCaptor.forClass(EventEntity.class);
        verify(eventRepository).save(saved.capture());
        assertEquals(Map.of(), saved.getValue().getMetadata());
    }

    @Test
    void testIngestOrder_StoredAsCompletedAndCounted() {
        // Given
        OrderIngestRequest request = OrderIngestRequest.builder()
                .orderNumber("ORD-1001")
                .amount(new BigDecimal("59.90"))
                .itemsCount(2)
                .metadata(Map.of("product_id", "sku-7"))
                .build();
        when(orderRepository.save(any(OrderEntity.class))).thenAnswer(invocation -> {
            OrderEntity order = invocation.getArgument(0);
            order.setId(UUID.randomUUID());
            return order;
        });

        // When
        IngestResponse response = ingestionService.ingestOrder(request);

        // Then
        ArgumentCaptor<OrderEntity> saved = ArgumentCaptor.forClass(OrderEntity.class);
        verify(orderRepository).save(saved.capture());
        assertEquals(OrderEntity.STATUS_COMPLETED, saved.getValue().getStatus());
        assertEquals("USD", saved.getValue().getCurrency());
        assertNotNull(saved.getValue().getCompletedAt());
        assertNotNull(response.getId());
        // No transaction in a plain unit test, so the counter is updated immediately
        verify(realtimeCounterService).recordOrder();
    }

    private static EventEntity persisted(EventEntity event) {
        event.setId(UUID.randomUUID());
        event.setCreatedAt(Instant.now());
        return event;
    }
}
