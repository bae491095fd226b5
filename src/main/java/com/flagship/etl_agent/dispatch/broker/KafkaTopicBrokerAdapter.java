package com.flagship.etl_agent.dispatch.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.AbstractDispatchAdapter;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchError;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.dispatch.FailurePolicy;
import com.flagship.etl_agent.dispatch.TaskResult;
import com.flagship.etl_agent.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;

/**
 * Topic broker on Kafka.
 *
 * Published records carry the envelope JSON as value and the correlation ID both as
 * record key and as {@code x-correlation-id} header, so consumers that do not parse
 * envelopes can still trace the message.
 *
 * On the consumer side the ID in the envelope body wins; the header is the fallback
 * for producers that send plain JSON.
 */
@Slf4j
public class KafkaTopicBrokerAdapter extends AbstractDispatchAdapter {

    private final KafkaTemplate<String, String> kafkaTemplate;

    public KafkaTopicBrokerAdapter(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                   DispatchMetrics metrics, FailurePolicy failurePolicy) {
        super(objectMapper, metrics, failurePolicy);
        this.kafkaTemplate = kafkaTemplate;
    }

    @Override
    public DispatchBackend backend() {
        return DispatchBackend.TOPIC_BROKER;
    }

    @Override
    protected DispatchResult doSend(Envelope<?> envelope, String destination) {
        String json;
        try {
            json = serialize(envelope);
        } catch (JsonProcessingException e) {
            return DispatchResult.failed(DispatchError.serialization(backend(), destination, e),
                    envelope.correlationId());
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(destination, envelope.correlationId(), json);
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                envelope.correlationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> sent = kafkaTemplate.send(record).get();
            String messageId = sent.getRecordMetadata() != null
                    ? sent.getRecordMetadata().partition() + "-" + sent.getRecordMetadata().offset()
                    : null;
            return DispatchResult.accepted(backend(), destination, envelope.correlationId(), messageId);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.failed(DispatchError.unreachable(backend(), destination, e),
                    envelope.correlationId());
        } catch (ExecutionException | RuntimeException e) {
            return DispatchResult.failed(DispatchError.unreachable(backend(), destination, e),
                    envelope.correlationId());
        }
    }

    /**
     * Runs the handler subscribed to the record's topic.
     *
     * A value that is not an envelope is treated as bare payload.
     */
    public TaskResult onRecord(ConsumerRecord<String, String> record) {
        Envelope<JsonNode> envelope = toEnvelope(record);
        if (!envelope.hasCorrelationId()) {
            envelope = new Envelope<>(headerCorrelationId(record), envelope.data(), envelope.status());
        }
        return onReceive(record.topic(), envelope);
    }

    private Envelope<JsonNode> toEnvelope(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            return Envelope.withCorrelationId(null, null);
        }
        try {
            JsonNode node = objectMapper.readTree(record.value());
            if (node != null && node.isObject() && node.has("data")) {
                return objectMapper.convertValue(node, ENVELOPE_TYPE);
            }
            return Envelope.withCorrelationId(null, node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Record at {}-{}@{} is not JSON, passing it as text",
                    record.topic(), record.partition(), record.offset());
            return Envelope.withCorrelationId(null, objectMapper.getNodeFactory().textNode(record.value()));
        }
    }

    private static String headerCorrelationId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }
}
