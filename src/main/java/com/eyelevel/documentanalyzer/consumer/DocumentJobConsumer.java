package com.eyelevel.documentanalyzer.consumer;

import com.eyelevel.documentanalyzer.dispatch.SqsJobChannel;
import com.eyelevel.documentanalyzer.exception.MessageProcessingFailedException;
import com.eyelevel.documentanalyzer.service.job.JobRunner;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * An SQS message consumer for document jobs published by {@link SqsJobChannel}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.processing.dispatch.mode", havingValue = "sqs")
public class DocumentJobConsumer {

    private final JobRunner jobRunner;

    /**
     * Listens to the job queue and runs each job on the listener thread.
     * <p>
     * Messages without a usable job ID are dropped. Duplicate deliveries are dropped by the claim
     * inside {@link JobRunner#run(String)}.
     *
     * @param message The SQS message payload, expected to contain a "jobId".
     */
    @SqsListener(value = "${app.processing.dispatch.queue-name}", factory = "documentJobContainerFactory")
    public void processJobMessage(@Payload final Map<String, Object> message) {
        log.debug("Received new message on document job queue: {}", message);

        final Object idObject = message.get(SqsJobChannel.JOB_ID_KEY);
        if (!(idObject instanceof String jobId) || jobId.isBlank()) {
            log.error("[FATAL] SQS message is invalid or missing 'jobId'. Message will be dropped. Payload: {}", message);
            return;
        }

        log.info("Received document job {}", jobId);
        try {
            jobRunner.run(jobId);
        } catch (final Exception e) {
            log.error("Job {} could not be recorded. Re-throwing to trigger SQS redelivery.", jobId, e);
            throw new MessageProcessingFailedException("Processing failed for job " + jobId, e);
        }
    }
}
