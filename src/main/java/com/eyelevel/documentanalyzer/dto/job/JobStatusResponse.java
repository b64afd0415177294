package com.eyelevel.documentanalyzer.dto.job;

import com.eyelevel.documentanalyzer.dto.document.ParsedResult;
import com.eyelevel.documentanalyzer.model.JobState;
import lombok.Builder;
import lombok.Getter;

/**
 * Status of a dispatched job. {@code result} is present only once the job has SUCCEEDED;
 * {@code error} only once it has FAILED.
 */
@Getter
@Builder
public class JobStatusResponse {
    private final String jobId;
    private final Long documentId;
    private final JobState state;
    private final ParsedResult result;
    private final String error;
}
