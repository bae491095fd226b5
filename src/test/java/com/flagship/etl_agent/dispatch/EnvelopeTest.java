package com.flagship.etl_agent.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.config.JacksonConfig;
import com.flagship.etl_agent.observability.CorrelationContext;
import com.flagship.etl_agent.observability.CorrelationScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Envelope built inside a scope inherits the scope's ID")
    void inheritsIdFromContext() {
        try (CorrelationScope ignored = CorrelationScope.open("req-1")) {
            Envelope<String> envelope = Envelope.of("payload");
            assertEquals("req-1", envelope.correlationId());
            assertEquals("payload", envelope.data());
            assertNull(envelope.status());
        }
    }

    @Test
    @DisplayName("Envelope built outside any scope gets a fresh ID")
    void generatesIdOutsideScope() {
        Envelope<String> first = Envelope.of("a");
        Envelope<String> second = Envelope.of("b");

        assertDoesNotThrow(() -> UUID.fromString(first.correlationId()));
        assertNotEquals(first.correlationId(), second.correlationId());
    }

    @Test
    @DisplayName("Explicit ID wins over the context")
    void explicitIdWins() {
        try (CorrelationScope ignored = CorrelationScope.open("ctx")) {
            assertEquals("explicit", Envelope.withCorrelationId("explicit", 1).correlationId());
        }
    }

    @Test
    @DisplayName("Envelope without ID resolves the current one before sending")
    void resolvesMissingId() {
        Envelope<String> bare = Envelope.withCorrelationId(null, "x");
        assertFalse(bare.hasCorrelationId());

        try (CorrelationScope ignored = CorrelationScope.open("ctx")) {
            assertEquals("ctx", bare.withResolvedCorrelationId().correlationId());
        }
    }

    @Test
    @DisplayName("Wire format uses snake_case ID and status labels")
    void wireFormat() throws Exception {
        Envelope<Map<String, String>> envelope =
                Envelope.withCorrelationId("c-1", Map.of("message", "hi")).withStatus(MessageStatus.COMPLETED);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(envelope));

        assertEquals("c-1", json.get("correlation_id").asText());
        assertEquals("hi", json.get("data").get("message").asText());
        assertEquals("Completed", json.get("status").asText());
    }

    @Test
    @DisplayName("Envelope decodes from JSON with ID, data and status intact")
    void decodesFromJson() throws Exception {
        String json = "{\"correlation_id\":\"c-2\",\"data\":{\"name\":\"Ada\"},\"status\":\"Partially\"}";

        Envelope<Map<String, String>> envelope = objectMapper.readValue(json, new TypeReference<>() {});

        assertEquals("c-2", envelope.correlationId());
        assertEquals("Ada", envelope.data().get("name"));
        assertEquals(MessageStatus.PARTIALLY, envelope.status());
    }

    @Test
    @DisplayName("Status absent from JSON when not set")
    void statusOmittedWhenNull() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(Envelope.withCorrelationId("c", 1)));
        assertFalse(json.has("status"));
    }
}
