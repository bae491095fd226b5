package com.flagship.etl_agent.dispatch.taskqueue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.etl_agent.dispatch.Envelope;

import java.time.Instant;
import java.util.UUID;

/**
 * A job as stored on the Redis queue.
 *
 * The envelope is the only thing the worker learns about the producing request,
 * correlation ID included.
 *
 * @param attempts deliveries so far, incremented when a failed task is requeued
 */
public record QueuedTask<T>(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("enqueued_at") Instant enqueuedAt,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("envelope") Envelope<T> envelope) {

    /**
     * Creates a new task that has not been delivered yet.
     */
    public static <T> QueuedTask<T> create(String name, Envelope<T> envelope) {
        return new QueuedTask<>(UUID.randomUUID().toString(), name, Instant.now(), 0, envelope);
    }

    /**
     * Creates a copy for the next delivery attempt.
     */
    public QueuedTask<T> nextAttempt() {
        return new QueuedTask<>(id, name, enqueuedAt, attempts + 1, envelope);
    }
}
