package com.flagship.etl_agent.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The adapter in charge of each backend, resolved once at startup.
 *
 * Transport adapters are only created as beans when their backend is enabled and
 * configured (see the backend configuration classes). Every backend without one
 * gets a {@link DisabledDispatchAdapter}, so callers never need a null check and
 * always get a {@link DispatchError} back from a backend they cannot use.
 */
@Component
@Slf4j
public class DispatchAdapters {

    private final Map<DispatchBackend, DispatchAdapter> adapters;

    public DispatchAdapters(List<DispatchAdapter> available, DispatchProperties properties) {
        Map<DispatchBackend, DispatchAdapter> resolved = new EnumMap<>(DispatchBackend.class);
        for (DispatchAdapter adapter : available) {
            resolved.put(adapter.backend(), adapter);
        }

        for (DispatchBackend backend : DispatchBackend.values()) {
            if (resolved.containsKey(backend)) {
                log.info("{} dispatch enabled", backend.getKey());
                continue;
            }
            String reason = disabledReason(backend, properties);
            if (isFlaggedEnabled(backend, properties)) {
                log.error("{} disabled due to {}", backend.getKey(), reason);
            } else {
                log.info("{} dispatch disabled", backend.getKey());
            }
            resolved.put(backend, new DisabledDispatchAdapter(backend, reason));
        }
        this.adapters = Collections.unmodifiableMap(resolved);
    }

    public DispatchAdapter get(DispatchBackend backend) {
        return adapters.get(backend);
    }

    public List<DispatchAdapter> enabled() {
        return adapters.values().stream()
                .filter(DispatchAdapter::isEnabled)
                .toList();
    }

    /**
     * Backend key to "enabled" / "disabled", in declaration order.
     */
    public Map<String, String> status() {
        Map<String, String> status = new LinkedHashMap<>();
        adapters.forEach((backend, adapter) ->
                status.put(backend.getKey(), adapter.isEnabled() ? "enabled" : "disabled"));
        return status;
    }

    private static boolean isFlaggedEnabled(DispatchBackend backend, DispatchProperties properties) {
        return switch (backend) {
            case TASK_QUEUE -> properties.getTaskQueue().isEnabled();
            case ASYNC_QUEUE -> properties.getAsyncQueue().isEnabled();
            case TOPIC_BROKER -> properties.getBroker().isEnabled();
        };
    }

    private static String disabledReason(DispatchBackend backend, DispatchProperties properties) {
        if (!isFlaggedEnabled(backend, properties)) {
            return "backend not enabled";
        }
        return switch (backend) {
            case TASK_QUEUE -> "etl.dispatch.task-queue.broker-url not set";
            case ASYNC_QUEUE -> "async queue could not be created";
            case TOPIC_BROKER -> "etl.dispatch.broker.provider not set";
        };
    }
}
