package com.flagship.etl_agent.observability;

import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's correlation ID onto executor threads.
 *
 * The ID is captured when the task is submitted and installed through a
 * {@link CorrelationScope} on the worker thread, so the worker's previous state
 * is restored once the task finishes. Tasks submitted outside any unit of work
 * run with a cleared context rather than whatever the worker last held.
 */
public class CorrelationTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        String parentId = CorrelationContext.current().orElse(null);

        return () -> {
            if (parentId == null) {
                String previous = CorrelationContext.current().orElse(null);
                CorrelationContext.clear();
                try {
                    runnable.run();
                } finally {
                    CorrelationContext.set(previous);
                }
                return;
            }
            CorrelationScope.run(parentId, runnable);
        };
    }
}
