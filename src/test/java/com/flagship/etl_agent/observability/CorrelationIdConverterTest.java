package com.flagship.etl_agent.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that log lines carry the correlation ID of the unit of work they were
 * emitted in, and the placeholder outside of one.
 */
class CorrelationIdConverterTest {

    private Logger logger;
    private LineAppender appender;

    @BeforeEach
    void setUp() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        logger = context.getLogger("correlation-converter-test");
        logger.setLevel(Level.INFO);

        PatternLayout layout = new PatternLayout();
        layout.setContext(context);
        layout.getInstanceConverterMap().put("cid", CorrelationIdConverter.class.getName());
        layout.setPattern("[ %cid ] %msg");
        layout.start();

        appender = new LineAppender(layout);
        appender.setContext(context);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Lines inside a scope carry the scope's ID")
    void linesInsideScopeCarryId() {
        CorrelationScope.run("req-7", () -> logger.info("inside"));

        assertEquals(List.of("[ req-7 ] inside"), appender.lines);
    }

    @Test
    @DisplayName("Lines outside any scope carry the placeholder")
    void linesOutsideScopeCarryPlaceholder() {
        logger.info("outside");

        assertEquals(List.of("[ ** ] outside"), appender.lines);
    }

    @Test
    @DisplayName("Lines after a scope closed fall back to the outer ID")
    void linesAfterScopeUseOuterId() {
        try (CorrelationScope outer = CorrelationScope.open("outer")) {
            CorrelationScope.run("inner", () -> logger.info("first"));
            logger.info("second");
        }
        logger.info("third");

        assertEquals(List.of("[ inner ] first", "[ outer ] second", "[ ** ] third"), appender.lines);
    }

    /**
     * Formats at append time, like a console appender does.
     */
    private static class LineAppender extends AppenderBase<ILoggingEvent> {

        private final PatternLayout layout;
        private final List<String> lines = new CopyOnWriteArrayList<>();

        LineAppender(PatternLayout layout) {
            this.layout = layout;
        }

        @Override
        protected void append(ILoggingEvent event) {
            lines.add(layout.doLayout(event));
        }
    }
}
