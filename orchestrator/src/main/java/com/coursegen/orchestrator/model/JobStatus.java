package com.coursegen.orchestrator.model;

/**
 * Lifecycle of a course generation job.
 *
 * Transitions:
 *   PENDING → PROCESSING → COMPLETED
 *                        → FAILED
 *
 * COMPLETED and FAILED are terminal; no further mutation is accepted.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
