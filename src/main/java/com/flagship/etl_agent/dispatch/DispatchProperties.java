package com.flagship.etl_agent.dispatch;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature flags and connection settings of the dispatch backends.
 *
 * A backend runs only when it is enabled and its connection setting is present;
 * an enabled backend without connection setting is logged and replaced by a
 * {@link DisabledDispatchAdapter}.
 */
@ConfigurationProperties(prefix = "etl.dispatch")
@Getter
@Setter
public class DispatchProperties {

    private TaskQueue taskQueue = new TaskQueue();
    private AsyncQueue asyncQueue = new AsyncQueue();
    private Broker broker = new Broker();

    @Getter
    @Setter
    public static class TaskQueue {
        private boolean enabled = false;
        /** Redis URL of the queue, e.g. redis://localhost:6379/0. */
        private String brokerUrl;
        private String defaultQueue = "default";
        private Duration resultTtl = Duration.ofDays(1);
        private FailurePolicy failurePolicy = FailurePolicy.REPORT;
        /** Deliveries of a task whose handler keeps failing under RETHROW. */
        private int maxAttempts = 3;
        private Worker worker = new Worker();
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private int batchSize = 10;
        private long pollIntervalMs = 500;
        private Duration popTimeout = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class AsyncQueue {
        private boolean enabled = false;
        private int concurrency = 10;
        private int queueCapacity = 1000;
        private FailurePolicy failurePolicy = FailurePolicy.RETHROW;
    }

    @Getter
    @Setter
    public static class Broker {
        private boolean enabled = false;
        /** Kafka bootstrap servers. */
        private String provider;
        private List<String> topics = new ArrayList<>(List.of("in-topic"));
        private String groupId = "etl-agent";
        private int partitions = 3;
        private FailurePolicy failurePolicy = FailurePolicy.RETHROW;

        /**
         * Configured topics with surrounding blanks and empty entries removed.
         */
        public List<String> topicNames() {
            return topics.stream()
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .toList();
        }
    }
}
