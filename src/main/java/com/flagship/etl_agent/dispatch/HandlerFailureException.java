package com.flagship.etl_agent.dispatch;

import lombok.Getter;

/**
 * A handler failed under an adapter configured with {@link FailurePolicy#RETHROW}.
 */
@Getter
public class HandlerFailureException extends RuntimeException {

    private final DispatchBackend backend;
    private final String destination;
    private final String correlationId;

    public HandlerFailureException(DispatchBackend backend, String destination,
                                   String correlationId, Throwable cause) {
        super("Handler for " + backend.getKey() + " '" + destination + "' failed: " + cause.getMessage(), cause);
        this.backend = backend;
        this.destination = destination;
        this.correlationId = correlationId;
    }
}
