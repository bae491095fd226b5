package com.flagship.etl_agent.dispatch.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Kafka wiring, active only when the broker is enabled and has a provider.
 *
 * Configures:
 * - the subscribed topics, created if they don't exist
 * - the broker adapter over Boot's KafkaTemplate
 * - the listener consuming the subscribed topics
 */
@Configuration
@EnableKafka
@ConditionalOnExpression("${etl.dispatch.broker.enabled:false} and '${etl.dispatch.broker.provider:}' != ''")
public class BrokerConfig {

    @Bean
    public KafkaAdmin.NewTopics brokerTopics(DispatchProperties properties) {
        DispatchProperties.Broker broker = properties.getBroker();
        NewTopic[] topics = broker.topicNames().stream()
                .map(name -> TopicBuilder.name(name)
                        .partitions(broker.getPartitions())
                        .replicas(1)
                        .build())
                .toArray(NewTopic[]::new);
        return new KafkaAdmin.NewTopics(topics);
    }

    @Bean
    public KafkaTopicBrokerAdapter topicBrokerAdapter(KafkaTemplate<String, String> kafkaTemplate,
                                                      ObjectMapper objectMapper,
                                                      DispatchMetrics metrics,
                                                      DispatchProperties properties) {
        return new KafkaTopicBrokerAdapter(kafkaTemplate, objectMapper, metrics,
                properties.getBroker().getFailurePolicy());
    }

    @Bean
    public BrokerMessageListener brokerMessageListener(KafkaTopicBrokerAdapter topicBrokerAdapter,
                                                       DispatchProperties properties) {
        return new BrokerMessageListener(topicBrokerAdapter, properties.getBroker().topicNames());
    }
}
