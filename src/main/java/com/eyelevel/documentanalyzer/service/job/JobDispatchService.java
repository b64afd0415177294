package com.eyelevel.documentanalyzer.service.job;

import com.eyelevel.documentanalyzer.common.json.JsonParser;
import com.eyelevel.documentanalyzer.dispatch.JobChannel;
import com.eyelevel.documentanalyzer.dto.document.ParsedResult;
import com.eyelevel.documentanalyzer.dto.job.JobStatusResponse;
import com.eyelevel.documentanalyzer.exception.JobNotFoundException;
import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.repository.ProcessingJobRepository;
import com.eyelevel.documentanalyzer.service.processing.ExtractionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * The work dispatcher: reserves jobs for documents, hands them to the configured
 * {@link JobChannel} and answers job status lookups.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatchService {

    private final ProcessingJobRepository jobRepository;
    private final JobChannel jobChannel;
    private final JsonParser jsonParser;

    /**
     * Reserves a QUEUED job for the document and sends it once the surrounding transaction has
     * committed, so a worker can never observe a job whose document is not yet visible.
     *
     * @return the new job ID.
     */
    @Transactional
    public String submit(final Long documentId, final String filePath) {
        final ProcessingJob job = jobRepository.save(ProcessingJob.builder()
                                                                  .jobId(UUID.randomUUID().toString())
                                                                  .documentId(documentId)
                                                                  .filePath(filePath)
                                                                  .state(JobState.QUEUED)
                                                                  .build());
        log.info("Reserved job {} for Document ID: {}", job.getJobId(), documentId);
        sendAfterCommit(job);
        return job.getJobId();
    }

    @Transactional(readOnly = true)
    public JobStatusResponse getJobStatus(final String jobId) {
        final ProcessingJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        ParsedResult result = null;
        if (job.getState() == JobState.SUCCEEDED && job.getResultJson() != null) {
            final ExtractionOutcome outcome = jsonParser.parseObject(job.getResultJson(), ExtractionOutcome.class);
            if (outcome.getFields() != null) {
                result = ParsedResult.from(outcome.getFields());
            }
        }

        return JobStatusResponse.builder()
                                .jobId(job.getJobId())
                                .documentId(job.getDocumentId())
                                .state(job.getState())
                                .result(result)
                                .error(job.getState() == JobState.FAILED ? job.getErrorMessage() : null)
                                .build();
    }

    private void sendAfterCommit(final ProcessingJob job) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                jobChannel.send(job);
            }
        });
    }
}
