package com.eyelevel.documentanalyzer.dispatch;

import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.service.job.JobRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs jobs on the in-process {@code documentWorkerExecutor} pool.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.processing.dispatch.mode", havingValue = "local", matchIfMissing = true)
public class LocalJobChannel implements JobChannel {

    private final AsyncTaskExecutor workerExecutor;
    private final JobRunner jobRunner;

    public LocalJobChannel(@Qualifier("documentWorkerExecutor") AsyncTaskExecutor workerExecutor,
                           JobRunner jobRunner) {
        this.workerExecutor = workerExecutor;
        this.jobRunner = jobRunner;
    }

    @Override
    public void send(final ProcessingJob job) {
        try {
            workerExecutor.execute(() -> jobRunner.run(job.getJobId()));
            log.info("Job {} for Document ID {} submitted to the worker pool.", job.getJobId(), job.getDocumentId());
        } catch (final TaskRejectedException e) {
            log.error("Worker pool rejected job {} for Document ID {}.", job.getJobId(), job.getDocumentId(), e);
            jobRunner.reject(job, "Worker pool is saturated; job was not accepted.");
        }
    }
}
