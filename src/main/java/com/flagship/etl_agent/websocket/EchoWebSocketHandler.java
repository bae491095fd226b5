package com.flagship.etl_agent.websocket;

import com.flagship.etl_agent.observability.CorrelationScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Echo endpoint that tracks its connections by correlation ID.
 *
 * Every callback runs under the connection's ID, so log lines of one connection
 * can be followed from handshake to close.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EchoWebSocketHandler extends TextWebSocketHandler {

    static final CloseStatus DUPLICATE_CONNECTION =
            CloseStatus.POLICY_VIOLATION.withReason("Correlation ID already connected");

    private final ConnectionRegistry registry;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String correlationId = CorrelationHandshakeInterceptor.correlationId(session.getAttributes());
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            if (!registry.register(correlationId, session)) {
                session.close(DUPLICATE_CONNECTION);
                return;
            }
            log.info("WebSocket connected: {}", correlationId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        String correlationId = CorrelationHandshakeInterceptor.correlationId(session.getAttributes());
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            log.debug("Received message: {}", message.getPayload());
            session.sendMessage(new TextMessage("Message received: " + message.getPayload()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String correlationId = CorrelationHandshakeInterceptor.correlationId(session.getAttributes());
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            log.warn("WebSocket transport error: {}", exception.getMessage());
            if (registry.deregister(correlationId, session)) {
                log.info("WebSocket disconnected: {} (transport error)", correlationId);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String correlationId = CorrelationHandshakeInterceptor.correlationId(session.getAttributes());
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            if (registry.deregister(correlationId, session)) {
                log.info("WebSocket disconnected: {} ({})", correlationId, status);
            }
        }
    }
}
