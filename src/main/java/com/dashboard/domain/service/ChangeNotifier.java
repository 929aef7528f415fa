package com.dashboard.domain.service;

import com.dashboard.domain.model.ChangeNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of connected observers with best-effort fan-out.
 * 
 * A failed delivery removes that observer and does not affect the others.
 * There is no ordering or redelivery guarantee.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeNotifier {

    private final ObjectMapper objectMapper;

    private final Map<String, NotificationObserver> observers = new ConcurrentHashMap<>();

    public void register(NotificationObserver observer) {
        observers.put(observer.getId(), observer);
        log.debug("Observer connected: {} ({} active)", observer.getId(), observers.size());
    }

    public boolean unregister(String observerId) {
        boolean removed = observers.remove(observerId) != null;
        if (removed) {
            log.debug("Observer disconnected: {} ({} active)", observerId, observers.size());
        }
        return removed;
    }

    public Optional<NotificationObserver> find(String observerId) {
        return Optional.ofNullable(observers.get(observerId));
    }

    public int observerCount() {
        return observers.size();
    }

    /**
     * @return number of observers the notification was delivered to
     */
    public int broadcast(ChangeNotification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize notification {}: {}", notification.getType(), e.getMessage());
            return 0;
        }
        return broadcast(payload);
    }

    public int broadcast(String message) {
        int delivered = 0;
        for (NotificationObserver observer : observers.values()) {
            try {
                observer.send(message);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping observer {} after failed delivery: {}", observer.getId(), e.getMessage());
                observers.remove(observer.getId(), observer);
                close(observer);
            }
        }
        log.debug("Broadcast delivered to {} observers", delivered);
        return delivered;
    }

    private void close(NotificationObserver observer) {
        try {
            observer.close();
        } catch (IOException e) {
            log.debug("Error closing observer {}: {}", observer.getId(), e.getMessage());
        }
    }
}
