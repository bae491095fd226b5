package com.flagship.etl_agent.dispatch.broker;

import com.flagship.etl_agent.dispatch.DispatchAdapters;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.observability.CorrelationContext;
import com.flagship.etl_agent.observability.CorrelationScope;
import com.flagship.etl_agent.worker.MessageContent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Topic broker round trip through a real Kafka:
 * - The listener delivers published envelopes to the subscribed handler
 * - The handler runs under the publisher's correlation ID
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class KafkaBrokerIntegrationTest {

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("etl.dispatch.broker.enabled", () -> "true");
        registry.add("etl.dispatch.broker.provider", kafka::getBootstrapServers);
        registry.add("etl.dispatch.broker.topics", () -> "in-topic,it-topic");
    }

    @Autowired
    private DispatchAdapters dispatchAdapters;

    @Test
    @DisplayName("Published envelope reaches the subscriber under the publisher's ID")
    void roundTripKeepsCorrelationId() throws Exception {
        CompletableFuture<String> seenId = new CompletableFuture<>();
        CompletableFuture<MessageContent> seenData = new CompletableFuture<>();
        dispatchAdapters.get(DispatchBackend.TOPIC_BROKER).subscribe("it-topic", MessageContent.class, envelope -> {
            seenId.complete(CorrelationContext.current().orElse(null));
            seenData.complete(envelope.data());
            return null;
        });

        DispatchResult result;
        try (CorrelationScope ignored = CorrelationScope.open("kafka-it-1")) {
            result = dispatchAdapters.get(DispatchBackend.TOPIC_BROKER)
                    .send(new MessageContent("Send for it-topic", "2024-03-19T10:00:01Z"), "it-topic");
        }

        assertTrue(result.isAccepted(), () -> String.valueOf(result.error()));
        assertEquals("kafka-it-1", seenId.get(30, TimeUnit.SECONDS));
        assertEquals("Send for it-topic", seenData.get(5, TimeUnit.SECONDS).message());
    }

    @Test
    @DisplayName("Caller-built envelope keeps its ID across the broker")
    void envelopeIdSurvives() throws Exception {
        CompletableFuture<String> seenId = new CompletableFuture<>();
        dispatchAdapters.get(DispatchBackend.TOPIC_BROKER).subscribe("in-topic", Object.class, envelope -> {
            seenId.complete(envelope.correlationId());
            return null;
        });

        DispatchResult result = dispatchAdapters.get(DispatchBackend.TOPIC_BROKER)
                .sendEnvelope(Envelope.withCorrelationId("kafka-it-2", "payload"), "in-topic");

        assertTrue(result.isAccepted(), () -> String.valueOf(result.error()));
        assertEquals("kafka-it-2", seenId.get(30, TimeUnit.SECONDS));
    }
}
