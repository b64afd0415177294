package com.eyelevel.documentanalyzer.exception.json;

import java.io.Serial;

/**
 * Thrown when a job result cannot be written to or read back from its stored JSON form.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7120925863164457082L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
