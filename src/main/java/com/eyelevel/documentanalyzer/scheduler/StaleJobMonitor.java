package com.eyelevel.documentanalyzer.scheduler;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.repository.FinancialDocumentRepository;
import com.eyelevel.documentanalyzer.repository.ProcessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Reports documents and jobs that have not reached a terminal state within the configured
 * threshold. A document whose worker died mid-run stays PENDING forever; this makes it visible.
 * It never changes any state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleJobMonitor {

    private final FinancialDocumentRepository documentRepository;
    private final ProcessingJobRepository jobRepository;
    private final DocumentProcessingConfig config;

    /**
     * @return the number of stale documents and jobs found.
     */
    @Scheduled(cron = "${app.processing.monitor.cron:0 */15 * * * *}")
    @Transactional(readOnly = true)
    public int reportStaleWork() {
        final long staleAfterMinutes = config.getMonitor().getStaleAfterMinutes();
        final LocalDateTime threshold = LocalDateTime.now().minusMinutes(staleAfterMinutes);
        log.debug("Running stale work check for anything unfinished since {}.", threshold);

        final List<FinancialDocument> staleDocuments =
                documentRepository.findByStatusAndCreatedAtBefore(DocumentStatus.PENDING, threshold);
        final List<ProcessingJob> staleJobs =
                jobRepository.findByStateInAndUpdatedAtBefore(EnumSet.of(JobState.QUEUED, JobState.STARTED), threshold);

        if (CollectionUtils.isEmpty(staleDocuments) && CollectionUtils.isEmpty(staleJobs)) {
            log.debug("No stale documents or jobs found.");
            return 0;
        }

        for (final FinancialDocument document : staleDocuments) {
            log.warn("Document ID {} ('{}') has been PENDING for more than {} minutes. Job: {}",
                     document.getId(), document.getFilename(), staleAfterMinutes, document.getJobId());
        }
        for (final ProcessingJob job : staleJobs) {
            log.warn("Job {} for Document ID {} has been {} since {}.",
                     job.getJobId(), job.getDocumentId(), job.getState(), job.getUpdatedAt());
        }
        log.warn("Found {} stale documents and {} stale jobs.", staleDocuments.size(), staleJobs.size());
        return staleDocuments.size() + staleJobs.size();
    }
}
