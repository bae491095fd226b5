package com.flagship.etl_agent.dispatch.asyncqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Async queue wiring. The adapter owns its thread pool; it is not exposed as an
 * executor bean so Boot's applicationTaskExecutor stays in place.
 */
@Configuration
@ConditionalOnProperty(name = "etl.dispatch.async-queue.enabled", havingValue = "true")
public class AsyncQueueConfig {

    @Bean
    public AsyncQueueAdapter asyncQueueAdapter(ObjectMapper objectMapper, DispatchMetrics metrics,
                                               DispatchProperties properties) {
        return new AsyncQueueAdapter(objectMapper, metrics, properties.getAsyncQueue());
    }
}
