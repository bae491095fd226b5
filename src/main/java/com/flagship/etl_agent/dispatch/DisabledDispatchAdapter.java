package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.etl_agent.observability.CorrelationIdResolver;

/**
 * Stand-in for a backend that is switched off or misses its connection settings.
 *
 * Every send fails with {@link DispatchError.Kind#DISABLED}; subscriptions are ignored.
 */
public class DisabledDispatchAdapter implements DispatchAdapter {

    private final DispatchBackend backend;
    private final String reason;

    public DisabledDispatchAdapter(DispatchBackend backend, String reason) {
        this.backend = backend;
        this.reason = reason;
    }

    @Override
    public DispatchBackend backend() {
        return backend;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public DispatchResult send(Object payload, String destination) {
        String correlationId = payload instanceof Envelope<?> envelope && envelope.hasCorrelationId()
                ? envelope.correlationId()
                : CorrelationIdResolver.currentOrGenerate();
        return DispatchResult.failed(DispatchError.disabled(backend, destination, reason), correlationId);
    }

    @Override
    public DispatchResult sendEnvelope(Envelope<?> envelope, String destination) {
        return send(envelope, destination);
    }

    @Override
    public <T> void subscribe(String destination, Class<T> payloadType, EnvelopeHandler<T> handler) {
        // Nothing is ever delivered
    }

    @Override
    public TaskResult onReceive(String destination, Envelope<JsonNode> envelope) {
        return TaskResult.error(CorrelationIdResolver.resolve(envelope.correlationId()),
                backend.getKey() + " is disabled: " + reason);
    }
}
