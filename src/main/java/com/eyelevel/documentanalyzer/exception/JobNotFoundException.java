package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

public class JobNotFoundException extends ResourceNotFoundException {
    @Serial
    private static final long serialVersionUID = -7418326650379712540L;

    public JobNotFoundException(String jobId) {
        super("Processing job not found with ID: " + jobId);
    }
}
