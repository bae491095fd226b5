package com.flagship.etl_agent.config;

import com.flagship.etl_agent.observability.CorrelationTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;

/**
 * Correlation propagation onto Spring-managed executors.
 *
 * Boot applies a single TaskDecorator bean to the applicationTaskExecutor, which
 * also runs MVC async work.
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public TaskDecorator correlationTaskDecorator() {
        return new CorrelationTaskDecorator();
    }
}
