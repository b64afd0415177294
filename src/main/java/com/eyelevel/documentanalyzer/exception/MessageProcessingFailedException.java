package com.eyelevel.documentanalyzer.exception;

import java.io.Serial;

/**
 * Thrown by the SQS job consumer when a message could not be handled at all, so that the
 * listener container leaves it on the queue for redelivery.
 * NOTE: This is an internal exception and should NOT be handled by the GlobalExceptionHandler.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
