package com.flagship.etl_agent.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Server-sent events demo: elapsed seconds every period, then an end-of-stream event.
 * {@code /inline-sse} writes the same data as bare {@code data:} lines.
 *
 * The stream is written from the application task executor, which carries the
 * request's correlation ID onto the writing thread.
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class SseController {

    static final long RETRY_MILLIS = 15_000;

    private final TaskExecutor taskExecutor;
    private final ObjectMapper objectMapper;

    public SseController(@Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor,
                         ObjectMapper objectMapper) {
        this.taskExecutor = taskExecutor;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/sse")
    public SseEmitter sse(@RequestParam(name = "max_second", defaultValue = "5") @Min(0) int maxSecond,
                          @RequestParam(name = "period", defaultValue = "1") @Positive int period) {
        SseEmitter emitter = new SseEmitter((maxSecond + period + 5) * 1000L);
        taskExecutor.execute(() -> stream(emitter, maxSecond, period));
        return emitter;
    }

    @GetMapping("/inline-sse")
    public ResponseEntity<StreamingResponseBody> inlineSse(
            @RequestParam(name = "max_second", defaultValue = "5") @Min(0) int maxSecond,
            @RequestParam(name = "period", defaultValue = "1") @Positive int period) {
        StreamingResponseBody body = out -> {
            long start = System.currentTimeMillis();
            while (System.currentTimeMillis() - start < maxSecond * 1000L) {
                long elapsed = (System.currentTimeMillis() - start) / 1000;
                String line = "data: "
                        + objectMapper.writeValueAsString(Map.of("elapsed_seconds", elapsed + "s"))
                        + "\n\n";
                out.write(line.getBytes(StandardCharsets.UTF_8));
                out.flush();
                try {
                    Thread.sleep(period * 1000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            log.debug("Inline SSE stream finished");
        };
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(body);
    }

    private void stream(SseEmitter emitter, int maxSecond, int period) {
        long start = System.currentTimeMillis();
        int counter = 0;
        try {
            while (System.currentTimeMillis() - start < maxSecond * 1000L) {
                long elapsed = (System.currentTimeMillis() - start) / 1000;
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(counter++))
                        .name("data")
                        .reconnectTime(RETRY_MILLIS)
                        .data(Map.of("elapsed_seconds", elapsed + "s"), MediaType.APPLICATION_JSON));
                Thread.sleep(period * 1000L);
            }
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(counter))
                    .name("eol")
                    .reconnectTime(RETRY_MILLIS)
                    .data(""));
            emitter.complete();
            log.debug("SSE stream finished after {} events", counter);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.completeWithError(e);
        } catch (IOException | IllegalStateException e) {
            // Client went away
            log.debug("SSE stream aborted: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
