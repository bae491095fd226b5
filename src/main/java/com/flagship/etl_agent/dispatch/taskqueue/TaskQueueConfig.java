package com.flagship.etl_agent.dispatch.taskqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchProperties;
import io.lettuce.core.RedisURI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Task queue wiring, active only when the task queue is enabled and has a broker URL.
 *
 * The connection is built from etl.dispatch.task-queue.broker-url so the queue can
 * live on a different Redis than anything else the service might use.
 */
@Configuration
@EnableScheduling
@ConditionalOnExpression("${etl.dispatch.task-queue.enabled:false} and '${etl.dispatch.task-queue.broker-url:}' != ''")
public class TaskQueueConfig {

    @Bean
    public LettuceConnectionFactory taskQueueConnectionFactory(DispatchProperties properties) {
        RedisURI uri = RedisURI.create(properties.getTaskQueue().getBrokerUrl());

        RedisStandaloneConfiguration configuration =
                new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        configuration.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            configuration.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null) {
            configuration.setPassword(RedisPassword.of(uri.getPassword()));
        }
        return new LettuceConnectionFactory(configuration);
    }

    @Bean
    public StringRedisTemplate taskQueueRedisTemplate(LettuceConnectionFactory taskQueueConnectionFactory) {
        return new StringRedisTemplate(taskQueueConnectionFactory);
    }

    @Bean
    public RedisTaskQueueAdapter taskQueueAdapter(StringRedisTemplate taskQueueRedisTemplate,
                                                  ObjectMapper objectMapper,
                                                  DispatchMetrics metrics,
                                                  DispatchProperties properties) {
        return new RedisTaskQueueAdapter(taskQueueRedisTemplate, objectMapper, metrics, properties.getTaskQueue());
    }

    @Bean
    @ConditionalOnProperty(name = "etl.dispatch.task-queue.worker.enabled", havingValue = "true", matchIfMissing = true)
    public TaskQueueWorker taskQueueWorker(RedisTaskQueueAdapter taskQueueAdapter, DispatchProperties properties) {
        return new TaskQueueWorker(taskQueueAdapter, properties.getTaskQueue().getWorker().getBatchSize());
    }
}
