package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

/**
 * Thrown when an uploaded file fails the pre-flight checks (empty content, unusable name).
 */
public class InvalidUploadException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public InvalidUploadException(String message) {
        super(message);
    }
}
