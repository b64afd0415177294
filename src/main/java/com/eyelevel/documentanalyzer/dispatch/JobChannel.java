package com.eyelevel.documentanalyzer.dispatch;

import com.eyelevel.documentanalyzer.model.ProcessingJob;

/**
 * Transport that carries a reserved job to a worker. Delivery is at-least-once; the worker's
 * claim step discards duplicates.
 */
public interface JobChannel {

    /**
     * Hands the job over for asynchronous execution. Must be called only after the job and its
     * document have been committed.
     */
    void send(ProcessingJob job);
}
