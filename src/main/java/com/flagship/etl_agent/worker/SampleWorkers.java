package com.flagship.etl_agent.worker;

import com.flagship.etl_agent.dispatch.DispatchAdapters;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.dispatch.MessageStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sample handlers for the demo destinations of each backend.
 *
 * Subscribing to a disabled backend is a no-op, so all handlers are registered
 * regardless of configuration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SampleWorkers {

    public static final String PING = "ping";
    public static final String HELLO_WORLD_AI = "hello_world_ai";
    public static final String IN_TOPIC = "in-topic";

    private final DispatchAdapters dispatchAdapters;

    @PostConstruct
    void subscribe() {
        dispatchAdapters.get(DispatchBackend.TASK_QUEUE).subscribe(PING, Object.class, this::taskQueuePing);
        dispatchAdapters.get(DispatchBackend.TASK_QUEUE).subscribe(HELLO_WORLD_AI, HelloRequest.class, this::helloWorld);
        dispatchAdapters.get(DispatchBackend.ASYNC_QUEUE).subscribe(PING, Object.class, this::asyncQueuePing);
        dispatchAdapters.get(DispatchBackend.TOPIC_BROKER).subscribe(IN_TOPIC, MessageContent.class, this::inTopic);
    }

    Object taskQueuePing(Envelope<Object> envelope) {
        log.info("Sample logging from task queue ping task");
        return null;
    }

    String helloWorld(Envelope<HelloRequest> envelope) {
        if (envelope.data() == null || envelope.data().name() == null) {
            throw new IllegalArgumentException("name is required");
        }
        log.info("received input name: {}", envelope.data().name());
        return "Hello " + envelope.data().name();
    }

    Map<String, String> asyncQueuePing(Envelope<Object> envelope) {
        log.info("Starting async queue ping task. Correlation ID: {}", envelope.correlationId());
        Map<String, String> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("correlation_id", envelope.correlationId());
        log.info("Completed async queue ping task: {}", result);
        return result;
    }

    Envelope<MessageContent> inTopic(Envelope<MessageContent> envelope) {
        log.info("Logging from in-topic when receiving message");
        return Envelope.withCorrelationId(envelope.correlationId(),
                        new MessageContent("pong from subscriber", Instant.now().toString()))
                .withStatus(MessageStatus.COMPLETED);
    }

    /**
     * Input of the hello_world_ai task.
     */
    public record HelloRequest(String name) {
    }
}
