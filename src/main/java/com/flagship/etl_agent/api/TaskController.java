package com.flagship.etl_agent.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.etl_agent.dispatch.DispatchAdapter;
import com.flagship.etl_agent.dispatch.DispatchAdapters;
import com.flagship.etl_agent.dispatch.DispatchBackend;
import com.flagship.etl_agent.dispatch.DispatchError;
import com.flagship.etl_agent.dispatch.DispatchException;
import com.flagship.etl_agent.dispatch.DispatchResult;
import com.flagship.etl_agent.dispatch.HandlerFailureException;
import com.flagship.etl_agent.dispatch.TaskResult;
import com.flagship.etl_agent.dispatch.asyncqueue.AsyncQueueAdapter;
import com.flagship.etl_agent.dispatch.taskqueue.RedisTaskQueueAdapter;
import com.flagship.etl_agent.observability.CorrelationIdResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Dispatches JSON payloads to a backend by name.
 *
 * Unlike the ping smoke test these calls need delivery: a backend that is disabled
 * or unreachable answers 503.
 */
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
@Slf4j
public class TaskController {

    private final DispatchAdapters dispatchAdapters;

    /**
     * Sends the body to the destination of the backend.
     *
     * @param backend     task-queue, async-queue or topic-broker
     * @param destination task name or topic
     * @param wait        async queue only: wait for the handler and return its result
     * @return 202 with the dispatch acknowledgement, or 200 with the result when waiting
     */
    @PostMapping("/{backend}/{destination}")
    public ResponseEntity<?> dispatch(@PathVariable("backend") String backend,
                                      @PathVariable("destination") String destination,
                                      @RequestBody(required = false) JsonNode payload,
                                      @RequestParam(name = "wait", defaultValue = "false") boolean wait) {
        DispatchAdapter adapter = dispatchAdapters.get(DispatchBackend.fromKey(backend));

        if (wait) {
            if (!(adapter instanceof AsyncQueueAdapter asyncQueue)) {
                if (!adapter.isEnabled()) {
                    adapter.send(payload, destination).orElseThrow();
                }
                throw new IllegalArgumentException("wait is only supported by the async-queue backend");
            }
            return ResponseEntity.ok(await(asyncQueue.enqueue(payload, destination)));
        }

        DispatchResult result = adapter.send(payload, destination).orElseThrow();
        log.info("Dispatched to {} '{}': messageId={}", backend, destination, result.messageId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    /**
     * Result of a task queue job; PENDING until a worker finished it.
     */
    @GetMapping("/{taskId}")
    public TaskResult result(@PathVariable("taskId") String taskId) {
        DispatchAdapter adapter = dispatchAdapters.get(DispatchBackend.TASK_QUEUE);
        if (!(adapter instanceof RedisTaskQueueAdapter taskQueue)) {
            throw new DispatchException(DispatchError.disabled(DispatchBackend.TASK_QUEUE, taskId,
                    "task queue results are not available"));
        }
        return taskQueue.result(taskId);
    }

    private static TaskResult await(CompletableFuture<TaskResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Async queue job failed: {}", cause.getMessage());
            String correlationId = cause instanceof HandlerFailureException failure
                    ? failure.getCorrelationId()
                    : CorrelationIdResolver.currentOrGenerate();
            Throwable detail = cause.getCause() != null ? cause.getCause() : cause;
            return TaskResult.error(correlationId, detail);
        }
    }
}
