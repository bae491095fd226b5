package com.flagship.etl_agent.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests and WebSocket handshakes (from header or generated)
 * - Task queue jobs and async queue jobs (inside the envelope)
 * - Kafka messages (envelope body and record header)
 * - All log statements (via MDC)
 *
 * Worker threads are pooled, so the value must never outlive the unit of work
 * that installed it. Prefer {@link CorrelationScope} over calling
 * {@link #set(String)} and {@link #clear()} by hand.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "x-correlation-id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the correlation ID of the current unit of work, if one is set.
     */
    public static Optional<String> current() {
        return Optional.ofNullable(correlationId.get());
    }

    /**
     * Sets the correlation ID for the current thread and mirrors it into the MDC.
     * A null ID clears the context.
     */
    public static void set(String id) {
        if (id == null) {
            clear();
            return;
        }
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
    }

    /**
     * Clears the correlation ID from the current thread.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Checks if a correlation ID is currently set.
     */
    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
