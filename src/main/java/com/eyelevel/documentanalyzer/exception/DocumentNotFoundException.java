package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

public class DocumentNotFoundException extends ResourceNotFoundException {
    @Serial
    private static final long serialVersionUID = 2268370385120513519L;

    public DocumentNotFoundException(Long documentId) {
        super("Document not found with ID: " + documentId);
    }
}
