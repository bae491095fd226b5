package com.flagship.etl_agent.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Error body returned by every failing request.
 *
 * Carries the correlation ID so the caller can quote it without reading headers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    Object error;
    @JsonProperty("correlation_id")
    String correlationId;
}
