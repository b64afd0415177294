package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

/**
 * Thrown when an uploaded file cannot be written to the upload directory.
 */
public class FileStorageException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public FileStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
