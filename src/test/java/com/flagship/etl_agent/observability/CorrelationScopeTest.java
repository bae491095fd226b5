package com.flagship.etl_agent.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the correlation context and its scopes:
 * - Scopes install the ID in the context and the MDC
 * - Closing restores the previous ID, also after an exception
 * - Threads never observe each other's ID
 */
class CorrelationScopeTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Opening a scope installs the ID in context and MDC")
    void openInstallsId() {
        try (CorrelationScope scope = CorrelationScope.open("req-1")) {
            assertEquals("req-1", scope.correlationId());
            assertEquals("req-1", CorrelationContext.current().orElseThrow());
            assertEquals("req-1", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        }

        assertFalse(CorrelationContext.hasCorrelationId());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Opening a scope without ID generates one")
    void openWithoutIdGenerates() {
        try (CorrelationScope scope = CorrelationScope.open(null)) {
            assertNotNull(scope.correlationId());
            assertFalse(scope.correlationId().isEmpty());
            assertEquals(scope.correlationId(), CorrelationContext.current().orElseThrow());
        }
    }

    @Test
    @DisplayName("Nested scopes restore the outer ID on close")
    void nestedScopesRestoreOuterId() {
        try (CorrelationScope outer = CorrelationScope.open("outer")) {
            try (CorrelationScope inner = CorrelationScope.open("inner")) {
                assertEquals("inner", CorrelationContext.current().orElseThrow());
            }
            assertEquals("outer", CorrelationContext.current().orElseThrow());
            assertEquals("outer", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        }
        assertTrue(CorrelationContext.current().isEmpty());
    }

    @Test
    @DisplayName("Previous ID is restored when the wrapped work throws")
    void restoresAfterException() {
        CorrelationContext.set("before");

        assertThrows(IllegalStateException.class, () -> CorrelationScope.run("during", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("before", CorrelationContext.current().orElseThrow());
    }

    @Test
    @DisplayName("Closing twice does not clobber a newer scope")
    void closeIsIdempotent() {
        CorrelationScope first = CorrelationScope.open("first");
        first.close();
        CorrelationContext.set("later");

        first.close();

        assertEquals("later", CorrelationContext.current().orElseThrow());
    }

    @Test
    @DisplayName("Concurrent units of work never see each other's ID")
    void concurrentScopesAreIsolated() throws Exception {
        int workers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(workers);
        AtomicInteger mismatches = new AtomicInteger();
        Set<String> seen = ConcurrentHashMap.newKeySet();

        try {
            for (int i = 0; i < workers; i++) {
                String id = "worker-" + i;
                executor.submit(() -> {
                    try {
                        start.await();
                        CorrelationScope.run(id, () -> {
                            for (int j = 0; j < 100; j++) {
                                if (!id.equals(CorrelationContext.current().orElse(null))
                                        || !id.equals(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY))) {
                                    mismatches.incrementAndGet();
                                }
                                Thread.yield();
                            }
                            seen.add(id);
                        });
                        if (CorrelationContext.hasCorrelationId()) {
                            mismatches.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, mismatches.get());
        assertEquals(workers, seen.size());
    }
}
