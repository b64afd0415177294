package com.eyelevel.documentanalyzer.dispatch;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.service.job.JobRunner;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes jobs to an SQS queue consumed by {@link com.eyelevel.documentanalyzer.consumer.DocumentJobConsumer},
 * possibly on another instance.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.processing.dispatch.mode", havingValue = "sqs")
public class SqsJobChannel implements JobChannel {

    public static final String JOB_ID_KEY = "jobId";

    private final SqsTemplate sqsTemplate;
    private final JobRunner jobRunner;
    private final String queueName;

    public SqsJobChannel(SqsTemplate sqsTemplate, JobRunner jobRunner, DocumentProcessingConfig config) {
        this.sqsTemplate = sqsTemplate;
        this.jobRunner = jobRunner;
        this.queueName = config.getDispatch().getQueueName();
    }

    @Override
    public void send(final ProcessingJob job) {
        final Map<String, Object> payload = Map.of(JOB_ID_KEY, job.getJobId());
        try {
            sqsTemplate.send(to -> to.queue(queueName).payload(payload));
            log.info("Successfully sent job {} for Document ID {} to queue '{}'", job.getJobId(), job.getDocumentId(),
                     queueName);
        } catch (final RuntimeException e) {
            log.error("Failed to send job {} for Document ID {} to queue '{}'. Failing the job.", job.getJobId(),
                      job.getDocumentId(), queueName, e);
            jobRunner.reject(job, "Job could not be sent to queue '" + queueName + "': " + e.getMessage());
        }
    }
}
