package com.eyelevel.documentanalyzer.service.job;

import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.service.document.DocumentRecordService;
import com.eyelevel.documentanalyzer.service.processing.DocumentProcessingService;
import com.eyelevel.documentanalyzer.service.processing.ExtractionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Worker-side entry point shared by every dispatch channel. Claims the job, runs the extraction
 * and records the result on the job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRunner {

    private final JobLifecycleManager jobLifecycleManager;
    private final DocumentProcessingService documentProcessingService;
    private final DocumentRecordService documentRecordService;

    /**
     * Runs the job if this worker can claim it. Jobs that are already running or finished are
     * dropped, so duplicate deliveries are harmless.
     */
    public void run(final String jobId) {
        final Optional<ProcessingJob> claimed = jobLifecycleManager.claim(jobId);
        if (claimed.isEmpty()) {
            log.warn("Could not claim job {}. It may not exist or is already running or finished. Dropping.", jobId);
            return;
        }

        final ProcessingJob job = claimed.get();
        log.info("Claimed job {} for Document ID: {}", jobId, job.getDocumentId());
        try {
            final ExtractionOutcome outcome = documentProcessingService.process(job.getDocumentId(), job.getFilePath());
            jobLifecycleManager.complete(jobId, outcome);
        } catch (final Exception e) {
            log.error("Job {} failed while processing Document ID: {}", jobId, job.getDocumentId(), e);
            jobLifecycleManager.fail(jobId, e);
        }
    }

    /**
     * Fails a job that could not be handed to any worker, together with its document.
     */
    public void reject(final ProcessingJob job, final String reason) {
        if (jobLifecycleManager.reject(job.getJobId(), reason)) {
            documentRecordService.markFailed(job.getDocumentId(), reason);
        }
    }
}
