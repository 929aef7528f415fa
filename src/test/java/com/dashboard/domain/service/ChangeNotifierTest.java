package com.dashboard.domain.service;

import com.dashboard.domain.model.ChangeNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChangeNotifierTest {

    @Mock
    private NotificationObserver healthy;

    @Mock
    private NotificationObserver broken;

    private ChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new ChangeNotifier(new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        lenient().when(healthy.getId()).thenReturn("healthy");
        lenient().when(broken.getId()).thenReturn("broken");
    }

    @Test
    void testBroadcast_FailedObserverRemovedOthersStillDelivered() throws IOException {
        // Given
        notifier.register(broken);
        notifier.register(healthy);
        doThrow(new IOException("Broken pipe")).when(broken).send(anyString());

        // When
        int delivered = notifier.broadcast(ChangeNotification.dataRefreshed(Instant.parse("2024-03-01T12:00:00Z")));

        // Then
        assertEquals(1, delivered);
        verify(healthy).send(contains("\"type\":\"data_refreshed\""));
        verify(broken).close();
        assertEquals(1, notifier.observerCount());
        assertTrue(notifier.find("broken").isEmpty());
    }

    @Test
    void testBroadcast_RemovedObserverNotRetried() throws IOException {
        // Given
        notifier.register(broken);
        doThrow(new IllegalStateException("session closed")).when(broken).send(anyString());

        // When
        notifier.broadcast("first");
        int delivered = notifier.broadcast("second");

        // Then
        assertEquals(0, delivered);
        verify(broken, times(1)).send(anyString());
    }

    @Test
    void testBroadcast_TimestampIsIsoString() throws IOException {
        // Given
        notifier.register(healthy);

        // When
        notifier.broadcast(ChangeNotification.dataRefreshed(Instant.parse("2024-03-01T12:00:00Z")));

        // Then
        verify(healthy).send(contains("\"timestamp\":\"2024-03-01T12:00:00Z\""));
    }

    @Test
    void testUnregister() {
        notifier.register(healthy);

        assertTrue(notifier.unregister("healthy"));
        assertFalse(notifier.unregister("healthy"));
        assertEquals(0, notifier.observerCount());
    }

    @Test
    void testBroadcast_NoObservers() {
        assertEquals(0, notifier.broadcast("hello"));
    }
}
