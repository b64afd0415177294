package com.eyelevel.documentanalyzer.service.processing;

/**
 * How a single extraction run ended.
 */
public enum OutcomeType {
    SUCCESS,
    /**
     * No document exists for the given ID. Nothing was written.
     */
    RECORD_NOT_FOUND,
    /**
     * The file path handed to the job does not point at a readable file. The document is FAILED.
     */
    FILE_NOT_FOUND,
    /**
     * The file holds no text. The document is FAILED.
     */
    EMPTY_CONTENT
}
