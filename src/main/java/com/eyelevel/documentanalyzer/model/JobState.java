package com.eyelevel.documentanalyzer.model;

/**
 * Lifecycle of a dispatched {@link ProcessingJob}.
 */
public enum JobState {
    /**
     * The job has been reserved and handed to a dispatch channel, but no worker has claimed it yet.
     */
    QUEUED,
    /**
     * A worker has claimed the job and is running the extraction.
     */
    STARTED,
    /**
     * The extraction finished and the document reached SUCCESS.
     */
    SUCCEEDED,
    /**
     * The run ended without a successful extraction (missing record or file, empty content, or an error).
     */
    FAILED;

    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED;
    }
}
