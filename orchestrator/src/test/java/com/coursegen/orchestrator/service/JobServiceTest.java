package com.coursegen.orchestrator.service;

import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.model.TestJobs;
import com.coursegen.orchestrator.repository.ArtifactRecordRepository;
import com.coursegen.orchestrator.repository.GenerationJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * Repositories and the launcher are mocked; no Spring context, no database.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock GenerationJobRepository  jobRepo;
    @Mock ArtifactRecordRepository artifactRepo;
    @Mock JobLauncher              launcher;

    JobService service;

    @BeforeEach
    void setUp() {
        service = new JobService(jobRepo, artifactRepo, launcher, Clock.systemUTC());
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_persistsPendingJobAndLaunchesIt() {
        GenerationJob saved = TestJobs.job("Python basics");
        when(jobRepo.save(any())).thenReturn(saved);

        GenerationJob result = service.submit("  Python basics ", List.of(UUID.randomUUID()));

        assertThat(result.getStatus()).isEqualTo(JobStatus.PENDING);
        verify(jobRepo).save(argThat(j -> j.getTopic().equals("Python basics") && j.getDocumentIds().size() == 1));
        verify(launcher).launch(saved.getId());
    }

    @Test
    void submit_stampsCreationTimeFromTheClock() {
        Instant now = Instant.parse("2026-04-02T09:30:00Z");
        service = new JobService(jobRepo, artifactRepo, launcher, Clock.fixed(now, ZoneOffset.UTC));
        when(jobRepo.save(any())).then(returnsFirstArg());

        GenerationJob result = service.submit("Kotlin", List.of());

        assertThat(result.getCreatedAt()).isEqualTo(now);
        assertThat(result.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    void submit_blankTopic_isRejectedBeforeAnythingIsSaved() {
        assertThatThrownBy(() -> service.submit(" ", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jobRepo, launcher);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_flagsTheWorker() {
        GenerationJob job = TestJobs.job("Go", JobStatus.PROCESSING);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(launcher.cancel(job.getId(), JobService.CANCELLED_MESSAGE)).thenReturn(true);

        service.cancel(job.getId());

        verify(launcher).cancel(job.getId(), JobService.CANCELLED_MESSAGE);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void cancel_terminalJob_isAnIllegalTransition() {
        GenerationJob job = TestJobs.job("Go", JobStatus.COMPLETED);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> service.cancel(job.getId())).isInstanceOf(JobTransitionException.class);
        verifyNoInteractions(launcher);
    }

    @Test
    void cancel_orphanedPendingJob_isFailedDirectly() {
        GenerationJob job = TestJobs.job("Go", JobStatus.PENDING);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.save(any())).then(returnsFirstArg());
        when(launcher.cancel(any(), any())).thenReturn(false);

        GenerationJob result = service.cancel(job.getId());

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo(JobService.CANCELLED_MESSAGE);
        assertThat(result.getProgress()).isLessThan(100);
    }

    @Test
    void cancel_unknownJob_throwsNoSuchElement() {
        UUID id = UUID.randomUUID();
        when(jobRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.cancel(id)).isInstanceOf(NoSuchElementException.class);
    }

    // ------------------------------------------------------------------
    // Restart recovery
    // ------------------------------------------------------------------

    @Test
    void recoverAfterRestart_failsProcessingAndRelaunchesPending() {
        GenerationJob orphan  = TestJobs.job("A", JobStatus.PROCESSING);
        orphan.setProgress(36);
        GenerationJob waiting = TestJobs.job("B", JobStatus.PENDING);
        when(jobRepo.findByStatus(JobStatus.PROCESSING)).thenReturn(List.of(orphan));
        when(jobRepo.findByStatus(JobStatus.PENDING)).thenReturn(List.of(waiting));
        when(jobRepo.save(any())).then(returnsFirstArg());

        service.recoverAfterRestart();

        assertThat(orphan.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(orphan.getErrorMessage()).isEqualTo(JobService.INTERRUPTED_MESSAGE);
        assertThat(orphan.getProgress()).isEqualTo(36);
        verify(launcher).launch(waiting.getId());
        verify(launcher, never()).launch(orphan.getId());
    }
}
