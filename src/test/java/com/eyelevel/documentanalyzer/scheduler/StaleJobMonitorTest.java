package com.eyelevel.documentanalyzer.scheduler;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.model.ProcessingJob;
import com.eyelevel.documentanalyzer.repository.FinancialDocumentRepository;
import com.eyelevel.documentanalyzer.repository.ProcessingJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StaleJobMonitor Unit Tests")
class StaleJobMonitorTest {

    @Mock
    private FinancialDocumentRepository documentRepository;

    @Mock
    private ProcessingJobRepository jobRepository;

    private StaleJobMonitor staleJobMonitor;

    @BeforeEach
    void setUp() {
        DocumentProcessingConfig config = new DocumentProcessingConfig();
        config.getMonitor().setStaleAfterMinutes(30);
        staleJobMonitor = new StaleJobMonitor(documentRepository, jobRepository, config);
    }

    @Test
    @DisplayName("Should count stale documents and jobs without changing them")
    void shouldReportStaleWork() {
        // Given
        when(documentRepository.findByStatusAndCreatedAtBefore(eq(DocumentStatus.PENDING), any(LocalDateTime.class)))
                .thenReturn(List.of(FinancialDocument.builder().id(1L).status(DocumentStatus.PENDING).build()));
        when(jobRepository.findByStateInAndUpdatedAtBefore(anyCollection(), any(LocalDateTime.class)))
                .thenReturn(List.of(ProcessingJob.builder().jobId("job-1").documentId(1L).state(JobState.QUEUED).build()));

        // When
        int stale = staleJobMonitor.reportStaleWork();

        // Then
        assertThat(stale).isEqualTo(2);
        verify(documentRepository, never()).markFailed(any(), any(), any(), any(), any());
        verify(jobRepository, never()).finish(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Should report nothing when all work is fresh or finished")
    void shouldReportNothing() {
        when(documentRepository.findByStatusAndCreatedAtBefore(eq(DocumentStatus.PENDING), any(LocalDateTime.class)))
                .thenReturn(List.of());
        when(jobRepository.findByStateInAndUpdatedAtBefore(anyCollection(), any(LocalDateTime.class)))
                .thenReturn(List.of());

        assertThat(staleJobMonitor.reportStaleWork()).isZero();
    }
}
