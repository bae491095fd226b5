package com.flagship.etl_agent.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the broker in-topic sample, both directions.
 */
public record MessageContent(
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") String timestamp) {
}
