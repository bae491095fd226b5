package com.flagship.etl_agent.dispatch.asyncqueue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.etl_agent.dispatch.AbstractDispatchAdapter;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchError;
import com.flagship.etl_agent.dispatch.DispatchException;
import com.flagship.etl_agent.dispatch.DispatchMetrics;
import com.flagship.etl_agent.dispatch.DispatchProperties;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.Envelope;
import com.flagship.etl_agent.dispatch.TaskResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * In-process job queue backed by a bounded thread pool.
 *
 * The envelope is serialized before it is queued and decoded on the worker thread,
 * so handlers see exactly what a remote worker would see and nothing else of the
 * producing thread leaks across, correlation ID included.
 */
@Slf4j
public class AsyncQueueAdapter extends AbstractDispatchAdapter implements DisposableBean {

    private final ThreadPoolTaskExecutor executor;

    public AsyncQueueAdapter(ObjectMapper objectMapper, DispatchMetrics metrics,
                             DispatchProperties.AsyncQueue properties) {
        super(objectMapper, metrics, properties.getFailurePolicy());

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("async-queue-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
    }

    @Override
    public DispatchBackend backend() {
        return DispatchBackend.ASYNC_QUEUE;
    }

    @Override
    protected DispatchResult doSend(Envelope<?> envelope, String destination) {
        try {
            submit(envelope, destination);
        } catch (JsonProcessingException e) {
            return DispatchResult.failed(DispatchError.serialization(backend(), destination, e),
                    envelope.correlationId());
        } catch (TaskRejectedException e) {
            return DispatchResult.failed(DispatchError.rejected(backend(), destination, e),
                    envelope.correlationId());
        }
        return DispatchResult.accepted(backend(), destination, envelope.correlationId(),
                UUID.randomUUID().toString());
    }

    /**
     * Queues a payload and returns the handler's result once a worker ran it.
     *
     * Under RETHROW the future completes exceptionally with the handler's failure.
     *
     * @throws DispatchException when the job could not be queued
     */
    public CompletableFuture<TaskResult> enqueue(Object payload, String destination) {
        Envelope<?> envelope = (payload instanceof Envelope<?> existing ? existing : Envelope.of(payload))
                .withResolvedCorrelationId();
        try {
            CompletableFuture<TaskResult> future = submit(envelope, destination);
            afterSend(DispatchResult.accepted(backend(), destination, envelope.correlationId(), null));
            return future;
        } catch (JsonProcessingException e) {
            DispatchResult failed = DispatchResult.failed(
                    DispatchError.serialization(backend(), destination, e), envelope.correlationId());
            afterSend(failed);
            throw new DispatchException(failed.error());
        } catch (TaskRejectedException e) {
            DispatchResult failed = DispatchResult.failed(
                    DispatchError.rejected(backend(), destination, e), envelope.correlationId());
            afterSend(failed);
            throw new DispatchException(failed.error());
        }
    }

    private CompletableFuture<TaskResult> submit(Envelope<?> envelope, String destination)
            throws JsonProcessingException {
        String json = serialize(envelope);
        return CompletableFuture.supplyAsync(() -> receive(destination, json), executor);
    }

    private TaskResult receive(String destination, String json) {
        Envelope<JsonNode> envelope;
        try {
            envelope = objectMapper.readValue(json, ENVELOPE_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Undecodable async queue job for '{}': {}", destination, e.getMessage());
            return TaskResult.error(null, e);
        }
        return onReceive(destination, envelope);
    }

    @Override
    public void destroy() {
        executor.shutdown();
    }
}
