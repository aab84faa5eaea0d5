package com.coursegen.orchestrator.service;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.pipeline.CancellationToken;
import com.coursegen.orchestrator.pipeline.PipelineOrchestrator;
import com.coursegen.orchestrator.repository.GenerationJobRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs pipelines on a fixed pool of job workers.
 *
 * A job is registered with its cancellation token the moment it is queued,
 * so a cancel issued while it still waits for a worker is honoured as soon
 * as the worker picks it up.
 */
@Component
public class JobLauncher {

    private static final Logger log = LoggerFactory.getLogger(JobLauncher.class);

    private final ExecutorService          workers;
    private final PipelineOrchestrator     orchestrator;
    private final GenerationJobRepository  jobRepo;
    private final Clock                    clock;

    private final Map<UUID, Running> running = new ConcurrentHashMap<>();

    private static final class Running {
        final CancellationToken token = new CancellationToken();
        Thread worker;   // guarded by this; set only while the pipeline runs

        synchronized void attach()  { worker = Thread.currentThread(); }

        synchronized void detach() {
            worker = null;
            Thread.interrupted();
        }

        synchronized void cancel(String reason) {
            token.cancel(reason);
            if (worker != null) worker.interrupt();
        }
    }

    public JobLauncher(PipelineOrchestrator orchestrator,
                       GenerationJobRepository jobRepo,
                       CourseGenProperties props,
                       Clock clock) {
        this.orchestrator = orchestrator;
        this.jobRepo      = jobRepo;
        this.clock        = clock;
        this.workers      = Executors.newFixedThreadPool(props.workers());
    }

    public void launch(UUID jobId) {
        Running r = new Running();
        if (running.putIfAbsent(jobId, r) != null) {
            log.warn("Job {} is already queued", jobId);
            return;
        }
        workers.submit(() -> execute(jobId, r));
        log.info("Job {} queued", jobId);
    }

    /**
     * Flags a queued or running job. The worker observes the flag before the
     * next stage or lesson and fails the job; a running worker is also
     * interrupted to cut short any wait it is blocked in.
     *
     * @return false if this launcher is not running the job
     */
    public boolean cancel(UUID jobId, String reason) {
        Running r = running.get(jobId);
        if (r == null) return false;
        r.cancel(reason);
        log.info("Job {} cancellation requested: {}", jobId, reason);
        return true;
    }

    public boolean isRunning(UUID jobId) {
        return running.containsKey(jobId);
    }

    private void execute(UUID jobId, Running r) {
        try {
            Optional<GenerationJob> job = jobRepo.findById(jobId);
            if (job.isEmpty()) {
                log.warn("Job {} vanished before it could start", jobId);
                return;
            }
            JobStateMachine machine = new JobStateMachine(job.get(), jobRepo, clock);
            r.attach();
            try {
                orchestrator.run(machine, r.token);
            } catch (Exception e) {
                log.error("Unhandled error in pipeline for job {}: {}", jobId, e.getMessage(), e);
                failIfProcessing(machine, "Unhandled exception: " + e.getMessage());
            } catch (Error e) {
                // the job is finalized before the error goes on to the pool
                log.error("Fatal error in pipeline for job {}", jobId, e);
                failIfProcessing(machine, "Fatal error: " + e);
                throw e;
            }
        } finally {
            r.detach();
            running.remove(jobId);
        }
    }

    private static void failIfProcessing(JobStateMachine machine, String message) {
        if (machine.status() == JobStatus.PROCESSING) {
            Thread.interrupted();
            machine.fail(message);
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
