package com.flagship.etl_agent.observability;

import java.util.concurrent.Callable;

/**
 * Installs a correlation ID for the duration of a unit of work.
 *
 * Usage:
 * <pre>
 * try (CorrelationScope scope = CorrelationScope.open(id)) {
 *     // every log line here is tagged with id
 * }
 * </pre>
 *
 * Closing the scope restores whatever ID was in place before it was opened,
 * including "none", whether the wrapped work returned normally or threw.
 * Scopes must be closed on the thread that opened them.
 */
public final class CorrelationScope implements AutoCloseable {

    private final String correlationId;
    private final String previous;
    private boolean closed;

    private CorrelationScope(String correlationId, String previous) {
        this.correlationId = correlationId;
        this.previous = previous;
    }

    /**
     * Opens a scope for the given ID. Passing null resolves a new one.
     */
    public static CorrelationScope open(String correlationId) {
        String previous = CorrelationContext.current().orElse(null);
        String id = CorrelationIdResolver.resolve(correlationId);
        CorrelationContext.set(id);
        return new CorrelationScope(id, previous);
    }

    /**
     * Runs the task inside a scope for the given ID.
     */
    public static void run(String correlationId, Runnable task) {
        try (CorrelationScope ignored = open(correlationId)) {
            task.run();
        }
    }

    /**
     * Calls the task inside a scope for the given ID and returns its result.
     */
    public static <T> T call(String correlationId, Callable<T> task) throws Exception {
        try (CorrelationScope ignored = open(correlationId)) {
            return task.call();
        }
    }

    public String correlationId() {
        return correlationId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        CorrelationContext.set(previous);
    }
}
