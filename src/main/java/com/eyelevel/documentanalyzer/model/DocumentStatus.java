package com.eyelevel.documentanalyzer.model;

/**
 * Defines the possible states of a {@link FinancialDocument} during its extraction lifecycle.
 * A document starts in {@link #PENDING} and moves exactly once to a terminal state.
 */
public enum DocumentStatus {
    /**
     * The document has been uploaded and is waiting for its background extraction run.
     */
    PENDING,
    /**
     * Extraction completed. The raw text and the parsed fields have been stored.
     */
    SUCCESS,
    /**
     * Extraction could not be completed. Raw text and parsed fields remain empty.
     */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
