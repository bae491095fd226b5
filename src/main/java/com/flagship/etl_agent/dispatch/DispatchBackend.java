package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The asynchronous execution backends a payload can be dispatched through.
 */
public enum DispatchBackend {
    TASK_QUEUE("task-queue"),
    ASYNC_QUEUE("async-queue"),
    TOPIC_BROKER("topic-broker");

    private final String key;

    DispatchBackend(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Looks a backend up by its path key ("task-queue") or enum name ("TASK_QUEUE").
     */
    public static DispatchBackend fromKey(String key) {
        return Arrays.stream(values())
                .filter(b -> b.key.equalsIgnoreCase(key) || b.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown dispatch backend: " + key));
    }
}
