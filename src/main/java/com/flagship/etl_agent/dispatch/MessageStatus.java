package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing state carried by an {@link Envelope}.
 *
 * Serialized by label ("Received", "Completed", ...) to stay compatible with
 * producers and consumers outside this service.
 */
public enum MessageStatus {
    RECEIVED("Received"),
    PROCESSING("Processing"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    RETRYING("Retrying"),
    CANCELLED("Cancelled"),
    PARTIALLY("Partially");

    private final String label;

    MessageStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static MessageStatus fromLabel(String label) {
        for (MessageStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown message status: " + label);
    }
}
