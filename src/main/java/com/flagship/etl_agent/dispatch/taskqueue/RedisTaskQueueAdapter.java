package com.flagship.etl_agent.dispatch.taskqueue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.AbstractDispatchAdapter;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchError;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchProperties;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.dispatch.HandlerFailureException;
import com.flagship.etl_agent.dispatch.TaskResult;
import com.flagship.etl_agent.observability.CorrelationScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Task queue on top of a Redis list, with results kept in Redis.
 *
 * Producer side: a send pushes a {@link QueuedTask} JSON to the tail of
 * {@code etl:queue:<queue>} and returns as soon as Redis accepted it.
 *
 * Worker side: {@link #processNext()} pops from the head, runs the handler named by
 * the task under the envelope's correlation ID, and stores the {@link TaskResult}
 * under {@code etl:task-result:<task id>} for {@code result-ttl}.
 *
 * Failure handling:
 * - REPORT: a failing handler produces an ERROR result, the task is done
 * - RETHROW: the task is requeued until max-attempts is reached, then stored as ERROR;
 *   the result stays PENDING while a retry is queued
 * - Unreadable queue entries are logged and dropped
 */
@Slf4j
public class RedisTaskQueueAdapter extends AbstractDispatchAdapter {

    private static final String QUEUE_KEY_PREFIX = "etl:queue:";
    private static final String RESULT_KEY_PREFIX = "etl:task-result:";
    private static final TypeReference<QueuedTask<JsonNode>> QUEUED_TASK_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final String queueKey;
    private final Duration resultTtl;
    private final Duration popTimeout;
    private final int maxAttempts;

    public RedisTaskQueueAdapter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                 DispatchMetrics metrics, DispatchProperties.TaskQueue properties) {
        super(objectMapper, metrics, properties.getFailurePolicy());
        this.redisTemplate = redisTemplate;
        this.queueKey = QUEUE_KEY_PREFIX + properties.getDefaultQueue();
        this.resultTtl = properties.getResultTtl();
        this.popTimeout = properties.getWorker().getPopTimeout();
        this.maxAttempts = Math.max(1, properties.getMaxAttempts());
    }

    @Override
    public DispatchBackend backend() {
        return DispatchBackend.TASK_QUEUE;
    }

    @Override
    protected DispatchResult doSend(Envelope<?> envelope, String destination) {
        QueuedTask<?> task = QueuedTask.create(destination, envelope);

        String json;
        try {
            json = serialize(task);
        } catch (JsonProcessingException e) {
            return DispatchResult.failed(DispatchError.serialization(backend(), destination, e),
                    envelope.correlationId());
        }

        try {
            redisTemplate.opsForList().rightPush(queueKey, json);
        } catch (RuntimeException e) {
            return DispatchResult.failed(DispatchError.unreachable(backend(), destination, e),
                    envelope.correlationId());
        }

        return DispatchResult.accepted(backend(), destination, envelope.correlationId(), task.id());
    }

    /**
     * Pops one task from the queue and runs it.
     *
     * @return false when the queue stayed empty for the pop timeout
     */
    public boolean processNext() {
        String json = redisTemplate.opsForList().leftPop(queueKey, popTimeout);
        if (json == null) {
            return false;
        }

        QueuedTask<JsonNode> task;
        try {
            task = objectMapper.readValue(json, QUEUED_TASK_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable task from {}: {}", queueKey, e.getMessage());
            return true;
        }

        Envelope<JsonNode> envelope = task.envelope() != null
                ? task.envelope()
                : Envelope.withCorrelationId(null, null);

        TaskResult result;
        try {
            result = onReceive(task.name(), envelope);
        } catch (HandlerFailureException e) {
            // No result while a retry is queued, readers keep seeing PENDING
            if (task.attempts() + 1 < maxAttempts && requeue(task.nextAttempt(), e.getCorrelationId())) {
                return true;
            }
            log.warn("Task {} '{}' failed {} times, giving up", task.id(), task.name(), task.attempts() + 1);
            result = TaskResult.error(e.getCorrelationId(), e.getCause());
        }

        storeResult(task.id(), result);
        return true;
    }

    /**
     * Looks up the stored result of a task; PENDING while it has not finished.
     */
    public TaskResult result(String taskId) {
        String json = redisTemplate.opsForValue().get(RESULT_KEY_PREFIX + taskId);
        if (json == null) {
            return TaskResult.pending(null);
        }
        try {
            return objectMapper.readValue(json, TaskResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored result of task " + taskId + " is unreadable", e);
        }
    }

    private boolean requeue(QueuedTask<JsonNode> task, String correlationId) {
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            redisTemplate.opsForList().rightPush(queueKey, serialize(task));
            log.info("Requeued task {} '{}' for attempt {}", task.id(), task.name(), task.attempts() + 1);
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to requeue task {} '{}': {}", task.id(), task.name(), e.getMessage());
            return false;
        }
    }

    private void storeResult(String taskId, TaskResult result) {
        try {
            redisTemplate.opsForValue().set(RESULT_KEY_PREFIX + taskId, serialize(result), resultTtl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to store result of task {}: {}", taskId, e.getMessage());
        }
    }
}
