package com.flagship.etl_agent.api;

import com.flagship.etl_agent.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SseControllerTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @DisplayName("Stream sends elapsed seconds, then an end-of-stream event")
    void streamsElapsedSeconds() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, "sse-1");

        ResponseEntity<String> response = restTemplate.exchange("/api/v1/sse?max_second=1&period=1",
                HttpMethod.GET, new HttpEntity<>(headers), String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("sse-1", response.getHeaders().getFirst(CorrelationContext.CORRELATION_ID_HEADER));

        String body = response.getBody();
        assertNotNull(body);
        assertTrue(body.contains("event:data"));
        assertTrue(body.contains("\"elapsed_seconds\":\"0s\""));
        assertTrue(body.contains("retry:15000"));
        assertTrue(body.contains("event:eol"));
        assertTrue(body.indexOf("event:data") < body.indexOf("event:eol"));
    }

    @Test
    @DisplayName("Inline stream writes bare data lines as text/event-stream")
    void inlineStreamWritesDataLines() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, "sse-inline");

        ResponseEntity<String> response = restTemplate.exchange("/api/v1/inline-sse?max_second=1&period=1",
                HttpMethod.GET, new HttpEntity<>(headers), String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_EVENT_STREAM));
        assertEquals("sse-inline", response.getHeaders().getFirst(CorrelationContext.CORRELATION_ID_HEADER));

        String body = response.getBody();
        assertNotNull(body);
        assertTrue(body.startsWith("data: {\"elapsed_seconds\":\"0s\"}\n\n"));
        assertFalse(body.contains("event:"));
    }

    @Test
    @DisplayName("Non-positive period is rejected")
    void rejectsInvalidPeriod() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/sse?period=0", String.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }
}
