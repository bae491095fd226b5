package com.flagship.etl_agent.dispatch;

/**
 * Business logic invoked for a delivered job or message.
 *
 * Runs with the envelope's correlation ID installed, so it can log and dispatch
 * follow-up work without handling the ID itself.
 *
 * @param <T> payload type the envelope data is converted to
 */
@FunctionalInterface
public interface EnvelopeHandler<T> {

    /**
     * @return the task result data, or null for fire-and-forget handlers
     */
    Object handle(Envelope<T> envelope) throws Exception;
}
