package com.eyelevel.documentanalyzer.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the worker pool that runs document extraction jobs when jobs are dispatched
 * in-process. It is kept apart from the servlet request threads.
 */
@Configuration
@ConditionalOnProperty(name = "app.processing.dispatch.mode", havingValue = "local", matchIfMissing = true)
public class TaskExecutorConfig {

    /**
     * Creates the worker pool. Sizes come from {@code app.processing.dispatch.worker.*}.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("documentWorkerExecutor")
    public AsyncTaskExecutor documentWorkerExecutor(final DocumentProcessingConfig config) {
        final DocumentProcessingConfig.Worker worker = config.getDispatch().getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCorePoolSize());
        executor.setMaxPoolSize(worker.getMaxPoolSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("doc-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(worker.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
