package com.flagship.etl_agent.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live WebSocket connections keyed by correlation ID.
 *
 * At most one session per ID. A mapping is only removed by the session it points
 * at, so a late close of a refused duplicate never evicts the live connection.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    // Active connections: correlationId -> session
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();

    /**
     * Registers the session under the ID.
     *
     * @return false when another session already holds the ID
     */
    public boolean register(String correlationId, WebSocketSession session) {
        WebSocketSession existing = connections.putIfAbsent(correlationId, session);
        if (existing != null && existing != session) {
            log.warn("Connection {} already registered, refusing session {}", correlationId, session.getId());
            return false;
        }
        return true;
    }

    /**
     * Removes the mapping if it still points at this session.
     */
    public boolean deregister(String correlationId, WebSocketSession session) {
        return connections.remove(correlationId, session);
    }

    public Optional<WebSocketSession> find(String correlationId) {
        return Optional.ofNullable(connections.get(correlationId));
    }

    public int size() {
        return connections.size();
    }

    public Set<String> ids() {
        return Set.copyOf(connections.keySet());
    }
}
