package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.etl_agent.observability.CorrelationIdResolver;

/**
 * Wrapper that carries a payload and its correlation ID across a dispatch boundary.
 *
 * Wire shape:
 * <pre>
 * { "correlation_id": "...", "data": { ... }, "status": "Completed" }
 * </pre>
 *
 * Envelopes built through the factory methods inherit the correlation ID of the
 * current unit of work, so a handler answering a message needs no explicit ID.
 * Deserialized envelopes keep whatever the producer sent, possibly no ID at all;
 * the receiving adapter decides what to do about that.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope<T>(
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("data") T data,
        @JsonProperty("status") MessageStatus status) {

    /**
     * Wraps a payload under the current correlation ID (or a new one).
     */
    public static <T> Envelope<T> of(T data) {
        return new Envelope<>(CorrelationIdResolver.currentOrGenerate(), data, null);
    }

    /**
     * Wraps a payload with a status under the current correlation ID (or a new one).
     */
    public static <T> Envelope<T> of(T data, MessageStatus status) {
        return new Envelope<>(CorrelationIdResolver.currentOrGenerate(), data, status);
    }

    /**
     * Wraps a payload under an explicit correlation ID.
     */
    public static <T> Envelope<T> withCorrelationId(String correlationId, T data) {
        return new Envelope<>(correlationId, data, null);
    }

    @JsonIgnore
    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isEmpty();
    }

    /**
     * Returns this envelope, or a copy carrying the current correlation ID when it has none.
     */
    public Envelope<T> withResolvedCorrelationId() {
        if (hasCorrelationId()) {
            return this;
        }
        return new Envelope<>(CorrelationIdResolver.currentOrGenerate(), data, status);
    }

    public Envelope<T> withStatus(MessageStatus newStatus) {
        return new Envelope<>(correlationId, data, newStatus);
    }

    public <R> Envelope<R> withData(R newData) {
        return new Envelope<>(correlationId, newData, status);
    }
}
