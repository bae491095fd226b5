package com.flagship.etl_agent.api;

import com.flagship.etl_agent.dispatch.DispatchAdapter;
import com.flagship.etl_agent.dispatch.DispatchAdapters;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.worker.MessageContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints that also smoke-test the dispatch backends.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class PingController {

    static final String BROKER_SAMPLE_TOPIC = "in-topic";
    static final String PING_TASK = "ping";

    private final DispatchAdapters dispatchAdapters;

    @Value("${etl.app.version:1.0.0}")
    private String version;

    /**
     * Answers pong and sends a sample through every enabled backend.
     *
     * Sends are best effort: a failing backend is logged and the ping still succeeds.
     */
    @GetMapping("/ping")
    public Map<String, String> ping() {
        for (DispatchAdapter adapter : dispatchAdapters.enabled()) {
            DispatchResult result = adapter.send(samplePayload(adapter.backend()), destination(adapter.backend()));
            if (result.isAccepted()) {
                log.info("{} ping sent with correlation_id: {}", adapter.backend().getKey(), result.correlationId());
            } else {
                log.error("Failed to send {} ping: {}", adapter.backend().getKey(), result.error().reason());
            }
        }

        log.info("Sample logging from ping api");
        log.debug("Ping request received");

        Map<String, String> response = new LinkedHashMap<>();
        response.put("version", version);
        response.put("message", "pong");
        return response;
    }

    @GetMapping("/error")
    public Map<String, String> error() {
        throw new IllegalStateException("unhandled error");
    }

    private static String destination(DispatchBackend backend) {
        return backend == DispatchBackend.TOPIC_BROKER ? BROKER_SAMPLE_TOPIC : PING_TASK;
    }

    private static Object samplePayload(DispatchBackend backend) {
        if (backend == DispatchBackend.TOPIC_BROKER) {
            return Envelope.of(new MessageContent("Send for " + BROKER_SAMPLE_TOPIC, Instant.now().toString()));
        }
        return Envelope.of(null);
    }
}
