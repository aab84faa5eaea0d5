package com.coursegen.orchestrator.media;

/**
 * Thrown when local media work (rendering, composition, an external tool) fails.
 */
public class MediaException extends RuntimeException {

    public MediaException(String message) {
        super(message);
    }

    public MediaException(String message, Throwable cause) {
        super(message, cause);
    }
}
