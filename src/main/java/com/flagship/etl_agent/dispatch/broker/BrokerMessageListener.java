package com.flagship.etl_agent.dispatch.broker;

import com.flagship.etl_agent.dispatch.HandlerFailureException;
import com.flagship.etl_agent.dispatch.TaskResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;

import java.util.List;

/**
 * Kafka listener feeding the configured topics into {@link KafkaTopicBrokerAdapter}.
 *
 * Uses manual acknowledgment: the offset is committed after the handler ran, or after
 * it failed under REPORT. Under RETHROW the record is not acknowledged and the
 * container's error handler redelivers it.
 *
 * Subscribes to the same trimmed topic list {@link BrokerConfig} creates.
 */
@RequiredArgsConstructor
@Slf4j
public class BrokerMessageListener {

    private final KafkaTopicBrokerAdapter adapter;
    private final List<String> topics;

    public String[] getTopics() {
        return topics.toArray(String[]::new);
    }

    @KafkaListener(
        topics = "#{__listener.topics}",
        groupId = "${etl.dispatch.broker.group-id:etl-agent}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            TaskResult result = adapter.onRecord(record);
            ack.acknowledge();
            log.debug("Processed message at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), result.status());

        } catch (HandlerFailureException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage());
            // Not acknowledged, the message will be redelivered
            throw e;
        }
    }
}
