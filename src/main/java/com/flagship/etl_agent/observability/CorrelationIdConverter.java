package com.flagship.etl_agent.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.Map;

/**
 * Logback converter rendering the correlation ID of a log event.
 *
 * Registered in logback-spring.xml as {@code %cid}. The value is read from the
 * MDC snapshot taken when the event was created, so it stays correct with
 * asynchronous appenders. Events logged outside any unit of work render the
 * placeholder so the line format stays parseable.
 */
public class CorrelationIdConverter extends ClassicConverter {

    public static final String PLACEHOLDER = "**";

    @Override
    public String convert(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        String id = mdc == null ? null : mdc.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
        return id == null || id.isEmpty() ? PLACEHOLDER : id;
    }
}
