package com.coursegen.orchestrator.packaging;

/**
 * Stage 10 failed: the package directory or archive could not be written.
 * The only pipeline error that fails the job.
 */
public class PackagingException extends Exception {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
