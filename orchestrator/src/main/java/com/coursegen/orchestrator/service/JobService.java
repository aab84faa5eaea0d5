package com.coursegen.orchestrator.service;

import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.repository.ArtifactRecordRepository;
import com.coursegen.orchestrator.repository.GenerationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job lifecycle as seen from outside: submission, polling, cancellation and
 * recovery after a restart. Pipelines themselves run on {@link JobLauncher}.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String CANCELLED_MESSAGE   = "Cancelled by user";
    static final String INTERRUPTED_MESSAGE = "Interrupted by restart";

    private final GenerationJobRepository  jobRepo;
    private final ArtifactRecordRepository artifactRepo;
    private final JobLauncher              launcher;
    private final Clock                    clock;

    public JobService(GenerationJobRepository jobRepo,
                      ArtifactRecordRepository artifactRepo,
                      JobLauncher launcher,
                      Clock clock) {
        this.jobRepo      = jobRepo;
        this.artifactRepo = artifactRepo;
        this.launcher     = launcher;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Job submission
    // ------------------------------------------------------------------

    /**
     * Persist a PENDING job and queue it. Returns before any stage runs.
     *
     * @throws IllegalArgumentException if the topic is blank
     */
    public GenerationJob submit(String topic, List<UUID> documentIds) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        GenerationJob job = jobRepo.save(new GenerationJob(topic.trim(), documentIds, clock.instant()));
        log.info("Job {} submitted (topic='{}', documents={})",
                job.getId(), job.getTopic(), job.getDocumentIds().size());
        launcher.launch(job.getId());
        return job;
    }

    public Optional<GenerationJob> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /**
     * StageArtifact metadata of a job, in production order.
     */
    @Transactional(readOnly = true)
    public List<ArtifactRecord> getArtifacts(UUID jobId) {
        return artifactRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Ask a PENDING or PROCESSING job to stop. The running pipeline turns the
     * request into FAILED at its next checkpoint; a job no worker owns any
     * more is failed here directly.
     *
     * @return the job as stored after the request
     * @throws java.util.NoSuchElementException if the id is unknown
     * @throws JobTransitionException if the job already finished
     */
    public GenerationJob cancel(UUID jobId) {
        GenerationJob job = jobRepo.findById(jobId).orElseThrow();
        if (job.getStatus().isTerminal()) {
            throw new JobTransitionException(jobId, job.getStatus(), "cancel");
        }
        if (launcher.cancel(jobId, CANCELLED_MESSAGE)) {
            return job;
        }

        // No worker owns it: either it just finished or it was orphaned.
        job = jobRepo.findById(jobId).orElseThrow();
        if (job.getStatus().isTerminal()) {
            throw new JobTransitionException(jobId, job.getStatus(), "cancel");
        }
        JobStateMachine machine = new JobStateMachine(job, jobRepo, clock);
        if (machine.status() == JobStatus.PENDING) machine.start();
        machine.fail(CANCELLED_MESSAGE);
        return machine.job();
    }

    // ------------------------------------------------------------------
    // Restart recovery
    // ------------------------------------------------------------------

    /**
     * Jobs left PROCESSING lost their worker with the previous process and are
     * failed; jobs left PENDING never started and are queued again.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverAfterRestart() {
        List<GenerationJob> orphaned = jobRepo.findByStatus(JobStatus.PROCESSING);
        for (GenerationJob job : orphaned) {
            log.warn("Job {} was PROCESSING at shutdown (progress {}%)", job.getId(), job.getProgress());
            new JobStateMachine(job, jobRepo, clock).fail(INTERRUPTED_MESSAGE);
        }
        List<GenerationJob> pending = jobRepo.findByStatus(JobStatus.PENDING);
        for (GenerationJob job : pending) {
            launcher.launch(job.getId());
        }
        if (!orphaned.isEmpty() || !pending.isEmpty()) {
            log.info("Restart recovery: {} jobs failed, {} relaunched", orphaned.size(), pending.size());
        }
    }
}
