package com.flagship.etl_agent.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationTaskDecoratorTest {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setTaskDecorator(new CorrelationTaskDecorator());
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Task runs under the submitting thread's ID")
    void taskInheritsSubmitterId() throws Exception {
        CompletableFuture<String> seen = new CompletableFuture<>();

        CorrelationScope.run("parent", () ->
                executor.execute(() -> seen.complete(CorrelationContext.current().orElse(null))));

        assertEquals("parent", seen.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Pooled worker does not leak an ID into the next task")
    void workerDoesNotLeakId() throws Exception {
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();

        CorrelationScope.run("first", () ->
                executor.execute(() -> first.complete(CorrelationContext.current().orElse(null))));
        assertEquals("first", first.get(5, TimeUnit.SECONDS));

        executor.execute(() -> second.complete(CorrelationContext.current().orElse("none")));

        assertEquals("none", second.get(5, TimeUnit.SECONDS));
    }
}
