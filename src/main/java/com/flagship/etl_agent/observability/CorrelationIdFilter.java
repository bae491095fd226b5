package com.flagship.etl_agent.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet filter that extracts or generates correlation IDs for HTTP requests.
 *
 * This filter:
 * 1. Extracts correlation ID from incoming request header (x-correlation-id)
 * 2. Generates a new one if not present
 * 3. Installs it in the correlation context (and MDC) for the whole request
 * 4. Stamps it on the response header, error responses included
 * 5. Restores the previous context after the request completes
 *
 * WebSocket upgrade requests pass through here as well, so connections get
 * their ID the same way plain requests do.
 *
 * The resolved ID is kept as a request attribute; an async re-dispatch of the same
 * request reuses it instead of resolving the header again.
 *
 * Order: HIGHEST_PRECEDENCE ensures this runs before all other filters.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlationId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request);

        try (CorrelationScope scope = CorrelationScope.open(correlationId)) {
            // Set up front: a streamed or committed response ignores later headers
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);

        } finally {
            if (!response.isCommitted()) {
                response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
            }
        }
    }

    private String resolveCorrelationId(HttpServletRequest request) {
        Object assigned = request.getAttribute(CORRELATION_ID_ATTRIBUTE);
        if (isAsyncDispatch(request) && assigned instanceof String) {
            return (String) assigned;
        }
        String correlationId = CorrelationIdResolver.resolve(
                request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
        return correlationId;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }
}
