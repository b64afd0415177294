package com.eyelevel.documentanalyzer.service.job;

import com.eyelevel.documentanalyzer.common.json.JsonSerializer;
import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.repository.ProcessingJobRepository;
import com.eyelevel.documentanalyzer.service.processing.ExtractionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Owns the state transitions of {@link ProcessingJob}s. Every method commits in its own
 * transaction, independently of the worker that calls it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleManager {

    private final ProcessingJobRepository jobRepository;
    private final JsonSerializer jsonSerializer;

    /**
     * Atomically moves a QUEUED job to STARTED. Only one caller can win the claim, which is what
     * keeps a redelivered message from processing the same document twice.
     *
     * @return the claimed job, or empty if it does not exist or is not QUEUED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ProcessingJob> claim(final String jobId) {
        final int updated = jobRepository.claim(jobId, JobState.STARTED, JobState.QUEUED, LocalDateTime.now());
        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    /**
     * Records the outcome of a finished run. A successful extraction ends the job as SUCCEEDED;
     * any other outcome ends it as FAILED with the outcome's message.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void complete(final String jobId, final ExtractionOutcome outcome) {
        final JobState finalState = outcome.isSuccess() ? JobState.SUCCEEDED : JobState.FAILED;
        final String errorMessage = outcome.isSuccess() ? null : outcome.getMessage();
        final int updated = jobRepository.finish(jobId, finalState, jsonSerializer.serialize(outcome), errorMessage,
                                                 JobState.STARTED, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Job {} was not STARTED; could not record outcome {}.", jobId, outcome.getType());
            return;
        }
        log.info("Job {} finished as {} ({}).", jobId, finalState, outcome.getType());
    }

    /**
     * Marks a claimed job as FAILED after the run threw.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(final String jobId, final Throwable cause) {
        final String errorMessage = rootMessage(cause);
        final int updated = jobRepository.finish(jobId, JobState.FAILED, null, errorMessage, JobState.STARTED,
                                                 LocalDateTime.now());
        if (updated == 0) {
            log.warn("Job {} was not STARTED; could not record failure: {}", jobId, errorMessage);
            return;
        }
        log.error("Job {} marked as FAILED. Reason: {}", jobId, errorMessage);
    }

    /**
     * Marks a job that never reached a worker as FAILED.
     *
     * @return {@code true} if the job was still QUEUED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean reject(final String jobId, final String reason) {
        final int updated = jobRepository.finish(jobId, JobState.FAILED, null, reason, JobState.QUEUED,
                                                 LocalDateTime.now());
        if (updated == 0) {
            log.warn("Job {} was not QUEUED; rejection ignored.", jobId);
            return false;
        }
        log.error("Job {} rejected before processing. Reason: {}", jobId, reason);
        return true;
    }

    private static String rootMessage(final Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        final String detail = current.getMessage() == null ? current.getClass().getSimpleName()
                                                           : current.getClass().getSimpleName() + ": " + current.getMessage();
        return throwable == current ? detail : throwable.getMessage() + " (" + detail + ")";
    }
}
