package com.flagship.etl_agent.websocket;

import com.flagship.etl_agent.observability.CorrelationContext;
import com.flagship.etl_agent.observability.CorrelationIdResolver;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Copies the correlation ID of the upgrade request into the session attributes.
 *
 * The upgrade request already went through the correlation filter, so the ID in
 * context is the one echoed on the handshake response. The header lookup only
 * matters when the handshake is served outside the filter chain.
 */
public class CorrelationHandshakeInterceptor implements HandshakeInterceptor {

    public static final String CORRELATION_ID_ATTRIBUTE = "correlationId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String correlationId = CorrelationContext.current()
                .orElseGet(() -> CorrelationIdResolver.resolve(
                        request.getHeaders().getFirst(CorrelationContext.CORRELATION_ID_HEADER)));
        attributes.put(CORRELATION_ID_ATTRIBUTE, correlationId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    /**
     * The ID stored at handshake, or a new one for sessions that bypassed it.
     */
    public static String correlationId(Map<String, Object> attributes) {
        Object value = attributes.get(CORRELATION_ID_ATTRIBUTE);
        return value instanceof String id ? CorrelationIdResolver.resolve(id) : CorrelationIdResolver.generate();
    }
}
