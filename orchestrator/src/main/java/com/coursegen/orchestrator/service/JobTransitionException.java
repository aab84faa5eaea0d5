package com.coursegen.orchestrator.service;

import com.coursegen.orchestrator.model.JobStatus;

import java.util.UUID;

/**
 * A job lifecycle transition was requested from a state that does not allow it.
 */
public class JobTransitionException extends IllegalStateException {

    private final UUID      jobId;
    private final JobStatus current;

    public JobTransitionException(UUID jobId, JobStatus current, String attempted) {
        super("Job %s cannot %s while %s".formatted(jobId, attempted, current));
        this.jobId   = jobId;
        this.current = current;
    }

    public UUID jobId()         { return jobId; }
    public JobStatus current()  { return current; }
}
