package com.flagship.etl_agent.dispatch.taskqueue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Background worker draining the Redis task queue.
 *
 * Runs in the API process by default. Start a second instance of the application
 * with the web server off and the worker on to scale workers separately; the two
 * only share what is in the queued envelopes.
 *
 * Each execution pops up to batch-size tasks; an empty queue ends the batch early.
 */
@RequiredArgsConstructor
@Slf4j
public class TaskQueueWorker {

    private final RedisTaskQueueAdapter adapter;
    private final int batchSize;

    @Scheduled(fixedDelayString = "${etl.dispatch.task-queue.worker.poll-interval-ms:500}")
    public void drain() {
        try {
            for (int i = 0; i < batchSize; i++) {
                if (!adapter.processNext()) {
                    return;
                }
            }
        } catch (Exception e) {
            log.error("Error in task queue worker polling loop", e);
        }
    }
}
