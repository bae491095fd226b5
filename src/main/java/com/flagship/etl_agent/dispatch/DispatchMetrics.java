package com.flagship.etl_agent.dispatch;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Metrics for the dispatch adapters.
 *
 * - dispatch.sent: sends per backend, tagged accepted / failed
 * - dispatch.handled: handler runs per backend, tagged with the result status
 *
 * Use these for alerting on an unreachable backend or a failing worker.
 */
@Component
@RequiredArgsConstructor
public class DispatchMetrics {

    private final MeterRegistry meterRegistry;

    /**
     * Records the outcome of a send.
     */
    public void recordSend(DispatchBackend backend, boolean accepted) {
        meterRegistry.counter("dispatch.sent",
                "backend", backend.getKey(),
                "outcome", accepted ? "accepted" : "failed"
        ).increment();
    }

    /**
     * Records that a handler ran on a delivered envelope.
     */
    public void recordHandled(DispatchBackend backend, TaskStatus status) {
        meterRegistry.counter("dispatch.handled",
                "backend", backend.getKey(),
                "status", status.name().toLowerCase()
        ).increment();
    }
}
