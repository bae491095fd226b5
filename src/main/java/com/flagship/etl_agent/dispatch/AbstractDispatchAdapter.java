package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.observability.CorrelationIdResolver;
import com.flagship.etl_agent.observability.CorrelationScope;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Envelope handling shared by the transport-backed adapters.
 *
 * Subclasses only move serialized envelopes over their transport; correlation ID
 * stamping, handler lookup, payload conversion, failure policy and metrics live here.
 */
@Slf4j
public abstract class AbstractDispatchAdapter implements DispatchAdapter {

    protected static final TypeReference<Envelope<JsonNode>> ENVELOPE_TYPE = new TypeReference<>() {};

    protected final ObjectMapper objectMapper;
    protected final DispatchMetrics metrics;
    private final FailurePolicy failurePolicy;
    private final Map<String, Subscription<?>> subscriptions = new ConcurrentHashMap<>();

    protected AbstractDispatchAdapter(ObjectMapper objectMapper, DispatchMetrics metrics,
                                      FailurePolicy failurePolicy) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Hands an envelope that already carries a correlation ID to the transport.
     */
    protected abstract DispatchResult doSend(Envelope<?> envelope, String destination);

    @Override
    public boolean isEnabled() {
        return true;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    @Override
    public DispatchResult send(Object payload, String destination) {
        Envelope<?> envelope = payload instanceof Envelope<?> existing ? existing : Envelope.of(payload);
        return sendEnvelope(envelope, destination);
    }

    @Override
    public DispatchResult sendEnvelope(Envelope<?> envelope, String destination) {
        Envelope<?> outbound = envelope.withResolvedCorrelationId();
        DispatchResult result = doSend(outbound, destination);
        afterSend(result);
        return result;
    }

    protected void afterSend(DispatchResult result) {
        metrics.recordSend(backend(), result.isAccepted());
        if (result.isAccepted()) {
            log.debug("Dispatched to {} '{}': messageId={}",
                    backend().getKey(), result.destination(), result.messageId());
        } else {
            log.warn("Dispatch failed: {}", result.error().describe());
        }
    }

    @Override
    public <T> void subscribe(String destination, Class<T> payloadType, EnvelopeHandler<T> handler) {
        Subscription<?> previous = subscriptions.put(destination, new Subscription<>(payloadType, handler));
        if (previous != null) {
            log.warn("Replaced handler for {} '{}'", backend().getKey(), destination);
        }
        log.info("Registered {} handler for '{}'", backend().getKey(), destination);
    }

    @Override
    public TaskResult onReceive(String destination, Envelope<JsonNode> envelope) {
        String correlationId = CorrelationIdResolver.resolve(envelope.correlationId());

        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            Subscription<?> subscription = subscriptions.get(destination);
            if (subscription == null) {
                log.warn("No handler registered for {} '{}', dropping envelope", backend().getKey(), destination);
                metrics.recordHandled(backend(), TaskStatus.ERROR);
                return TaskResult.error(correlationId, "No handler registered for '" + destination + "'");
            }

            log.debug("Handling {} envelope for '{}'", backend().getKey(), destination);
            try {
                Object data = subscription.invoke(
                        new Envelope<>(correlationId, envelope.data(), envelope.status()), objectMapper);
                metrics.recordHandled(backend(), TaskStatus.SUCCESS);
                return TaskResult.success(correlationId, data);

            } catch (Exception e) {
                metrics.recordHandled(backend(), TaskStatus.ERROR);
                if (failurePolicy == FailurePolicy.RETHROW) {
                    log.error("Handler for {} '{}' failed: {}", backend().getKey(), destination, e.getMessage(), e);
                    throw new HandlerFailureException(backend(), destination, correlationId, e);
                }
                log.error("Handler for {} '{}' failed, reporting error result", backend().getKey(), destination, e);
                return TaskResult.error(correlationId, e);
            }
        }
    }

    protected String serialize(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    /**
     * A handler together with the type its payload is converted to.
     */
    private record Subscription<T>(Class<T> payloadType, EnvelopeHandler<T> handler) {

        Object invoke(Envelope<JsonNode> envelope, ObjectMapper objectMapper) throws Exception {
            JsonNode raw = envelope.data();
            T data = raw == null || raw.isNull() ? null : objectMapper.treeToValue(raw, payloadType);
            return handler.handle(envelope.withData(data));
        }
    }
}
