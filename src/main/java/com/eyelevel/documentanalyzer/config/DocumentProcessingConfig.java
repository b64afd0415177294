package com.eyelevel.documentanalyzer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object covering file storage, job dispatch, listing and monitoring.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class DocumentProcessingConfig {

    private Storage storage = new Storage();
    private Dispatch dispatch = new Dispatch();
    private Query query = new Query();
    private Monitor monitor = new Monitor();

    /**
     * How dispatched jobs reach a worker.
     */
    public enum DispatchMode {
        /**
         * An in-process thread pool.
         */
        LOCAL,
        /**
         * An Amazon SQS queue consumed by {@code @SqsListener}.
         */
        SQS
    }

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 200;
    }

    @Data
    public static class Storage {
        private String uploadDir = "./data/uploads";
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Dispatch {
        private DispatchMode mode = DispatchMode.LOCAL;
        private String queueName = "document-processing";
        private Worker worker = new Worker();
    }

    @Data
    public static class Worker {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 500;
        private int awaitTerminationSeconds = 30;
    }

    @Data
    public static class Query {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }

    @Data
    public static class Monitor {
        /**
         * Age after which a PENDING document or an unfinished job is reported as likely abandoned.
         */
        private long staleAfterMinutes = 60;
        private String cron = "0 */15 * * * *";
    }
}
