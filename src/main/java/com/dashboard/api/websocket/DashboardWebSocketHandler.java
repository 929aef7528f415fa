package com.dashboard.api.websocket;

import com.dashboard.domain.service.ChangeNotifier;
import com.dashboard.domain.service.NotificationObserver;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dashboard push channel.
 * 
 * Protocol:
 * - server → client: {"type":"data_refreshed","timestamp":...} after each refresh
 * - client → server: any text; answered with {"type":"ping","timestamp":...}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardWebSocketHandler extends TextWebSocketHandler {

    static final String PING = "ping";

    private final ChangeNotifier changeNotifier;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        changeNotifier.register(new WebSocketObserver(session));
        log.info("Dashboard client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("type", PING);
        reply.put("timestamp", Instant.now());

        String payload = objectMapper.writeValueAsString(reply);
        // Reply through the registered observer so it shares the session's send lock
        Optional<NotificationObserver> observer = changeNotifier.find(session.getId());
        if (observer.isPresent()) {
            observer.get().send(payload);
        } else {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
        changeNotifier.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        changeNotifier.unregister(session.getId());
        log.info("Dashboard client disconnected: {} ({})", session.getId(), status.getCode());
    }
}
