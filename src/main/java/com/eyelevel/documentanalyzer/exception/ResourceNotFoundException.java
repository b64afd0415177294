package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

/**
 * Base class for lookups that found nothing (HTTP 404).
 */
public class ResourceNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
