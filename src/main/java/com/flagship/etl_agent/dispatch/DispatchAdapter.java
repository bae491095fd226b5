package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Sends payloads through one asynchronous backend and runs handlers for what it delivers.
 *
 * Send side: the payload is wrapped in an {@link Envelope} stamped with the current
 * correlation ID, then handed to the transport. Transport failures come back as a
 * {@link DispatchResult} carrying a {@link DispatchError}; they are never thrown.
 *
 * Receive side: the transport runtime calls {@link #onReceive(String, Envelope)} for
 * every delivered envelope. The adapter installs the envelope's correlation ID for
 * the duration of the handler and applies its {@link FailurePolicy} to failures.
 */
public interface DispatchAdapter {

    DispatchBackend backend();

    /**
     * False when the backend is switched off or misconfigured; every send then fails
     * with {@link DispatchError.Kind#DISABLED}.
     */
    boolean isEnabled();

    /**
     * Wraps the payload in an envelope under the current correlation ID and sends it.
     * A payload that already is an {@link Envelope} is sent as-is.
     *
     * @param destination task name or topic
     */
    DispatchResult send(Object payload, String destination);

    /**
     * Sends a caller-built envelope. An envelope without correlation ID gets the
     * current one.
     */
    DispatchResult sendEnvelope(Envelope<?> envelope, String destination);

    /**
     * Registers the handler run for envelopes delivered to the destination.
     * Envelope data is converted to {@code payloadType} before the handler sees it.
     */
    <T> void subscribe(String destination, Class<T> payloadType, EnvelopeHandler<T> handler);

    /**
     * Runs the handler registered for the destination under the envelope's
     * correlation ID, generating one for envelopes that arrive without it.
     *
     * @throws HandlerFailureException when the handler fails and the policy is
     *                                 {@link FailurePolicy#RETHROW}
     */
    TaskResult onReceive(String destination, Envelope<JsonNode> envelope);
}
