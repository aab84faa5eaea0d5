package com.coursegen.orchestrator.pipeline;

/**
 * Unwinds a running pipeline once its job has been asked to cancel.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
