package com.eyelevel.documentanalyzer.consumer;

import com.eyelevel.documentanalyzer.exception.MessageProcessingFailedException;
import com.eyelevel.documentanalyzer.service.job.JobRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentJobConsumer Unit Tests")
class DocumentJobConsumerTest {

    @Mock
    private JobRunner jobRunner;

    @InjectMocks
    private DocumentJobConsumer documentJobConsumer;

    @Test
    @DisplayName("Should run the job named in the message")
    void shouldRunJob() {
        documentJobConsumer.processJobMessage(Map.of("jobId", "job-1"));

        verify(jobRunner).run("job-1");
    }

    @Test
    @DisplayName("Should drop messages without a job ID")
    void shouldDropInvalidMessage() {
        documentJobConsumer.processJobMessage(Map.of("documentId", 5));
        documentJobConsumer.processJobMessage(Map.of("jobId", 5));
        documentJobConsumer.processJobMessage(Map.of("jobId", " "));

        verifyNoInteractions(jobRunner);
    }

    @Test
    @DisplayName("Should rethrow so the message is redelivered when the outcome cannot be recorded")
    void shouldRethrowOnFailure() {
        doThrow(new DataAccessResourceFailureException("db down")).when(jobRunner).run("job-2");

        assertThatThrownBy(() -> documentJobConsumer.processJobMessage(Map.of("jobId", "job-2")))
                .isInstanceOf(MessageProcessingFailedException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
