package com.flagship.etl_agent.websocket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    @DisplayName("Registered session can be found by ID until deregistered")
    void registerAndDeregister() {
        WebSocketSession session = mock(WebSocketSession.class);

        assertTrue(registry.register("c-1", session));
        assertSame(session, registry.find("c-1").orElseThrow());
        assertEquals(Set.of("c-1"), registry.ids());

        assertTrue(registry.deregister("c-1", session));
        assertTrue(registry.find("c-1").isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Second session for the same ID is refused")
    void duplicateIdRefused() {
        WebSocketSession first = mock(WebSocketSession.class);
        WebSocketSession second = mock(WebSocketSession.class);

        assertTrue(registry.register("c-1", first));
        assertFalse(registry.register("c-1", second));

        assertSame(first, registry.find("c-1").orElseThrow());
    }

    @Test
    @DisplayName("Closing a refused duplicate does not evict the live session")
    void deregisterOnlyOwnMapping() {
        WebSocketSession first = mock(WebSocketSession.class);
        WebSocketSession second = mock(WebSocketSession.class);
        registry.register("c-1", first);

        assertFalse(registry.deregister("c-1", second));

        assertSame(first, registry.find("c-1").orElseThrow());
        assertEquals(1, registry.size());
    }
}
