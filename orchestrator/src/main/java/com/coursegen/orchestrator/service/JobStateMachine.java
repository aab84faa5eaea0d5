package com.coursegen.orchestrator.service;

import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * The only writer of a job's status and progress.
 *
 * <pre>
 *   PENDING ──start()──▶ PROCESSING ──complete()──▶ COMPLETED
 *                              └───────fail()─────▶ FAILED
 * </pre>
 * Every transition is saved before the method returns. Terminal states
 * accept nothing further: any call then throws {@link JobTransitionException}.
 * Progress only grows, and only {@link #complete} sets it to 100.
 */
public class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    private final GenerationJobRepository repository;
    private final Clock                   clock;
    private GenerationJob                 job;

    public JobStateMachine(GenerationJob job, GenerationJobRepository repository, Clock clock) {
        this.job        = job;
        this.repository = repository;
        this.clock      = clock;
    }

    public synchronized void start() {
        require(JobStatus.PENDING, "start");
        job.setStatus(JobStatus.PROCESSING);
        save();
        log.info("Job {} PROCESSING (topic='{}')", job.getId(), job.getTopic());
    }

    /**
     * @throws IllegalArgumentException if {@code progress} is below the current
     *         value or not below 100
     */
    public synchronized void advance(int progress) {
        require(JobStatus.PROCESSING, "advance");
        if (progress < job.getProgress()) {
            throw new IllegalArgumentException("Progress of job %s cannot go back from %d to %d"
                    .formatted(job.getId(), job.getProgress(), progress));
        }
        if (progress >= 100) {
            throw new IllegalArgumentException("Only completion sets progress to 100, got " + progress);
        }
        if (progress == job.getProgress()) return;
        job.setProgress(progress);
        save();
    }

    public synchronized void complete(String resultReference) {
        require(JobStatus.PROCESSING, "complete");
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(100);
        job.setResultReference(resultReference);
        job.setCompletedAt(clock.instant());
        save();
        log.info("Job {} COMPLETED: {}", job.getId(), resultReference);
    }

    /** Progress stays at its last value. */
    public synchronized void fail(String errorMessage) {
        require(JobStatus.PROCESSING, "fail");
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(errorMessage);
        job.setCompletedAt(clock.instant());
        save();
        log.error("Job {} FAILED at {}%: {}", job.getId(), job.getProgress(), errorMessage);
    }

    public synchronized GenerationJob job()  { return job; }
    public synchronized JobStatus status()   { return job.getStatus(); }
    public synchronized int progress()       { return job.getProgress(); }
    public UUID jobId()                      { return job.getId(); }

    private void require(JobStatus expected, String transition) {
        if (job.getStatus() != expected) {
            throw new JobTransitionException(job.getId(), job.getStatus(), transition);
        }
    }

    private void save() {
        job.setUpdatedAt(clock.instant());
        job = repository.save(job);
    }
}
