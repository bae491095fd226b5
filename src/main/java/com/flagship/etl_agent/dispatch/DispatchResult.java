package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a send: either accepted by the transport or a {@link DispatchError}.
 *
 * Sending never throws for transport problems. Callers that can live without the
 * side effect log the error; callers that cannot use {@link #orElseThrow()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(
        @JsonProperty("backend") DispatchBackend backend,
        @JsonProperty("destination") String destination,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("message_id") String messageId,
        @JsonProperty("error") DispatchError error) {

    public static DispatchResult accepted(DispatchBackend backend, String destination,
                                          String correlationId, String messageId) {
        return new DispatchResult(backend, destination, correlationId, messageId, null);
    }

    public static DispatchResult failed(DispatchError error, String correlationId) {
        return new DispatchResult(error.backend(), error.destination(), correlationId, null, error);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return error == null;
    }

    /**
     * Returns this result when accepted, otherwise throws a {@link DispatchException}.
     */
    public DispatchResult orElseThrow() {
        if (error != null) {
            throw new DispatchException(error);
        }
        return this;
    }
}
