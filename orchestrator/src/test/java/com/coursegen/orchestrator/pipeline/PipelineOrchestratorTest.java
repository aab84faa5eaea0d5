package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.model.TestJobs;
import com.coursegen.orchestrator.packaging.CoursePackager;
import com.coursegen.orchestrator.packaging.PackagingException;
import com.coursegen.orchestrator.provider.Prompt;
import com.coursegen.orchestrator.provider.TextProvider;
import com.coursegen.orchestrator.service.JobStateMachine;
import com.coursegen.orchestrator.service.JobTransitionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    @TempDir Path output;

    PipelineFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) fixture.close();
    }

    // ------------------------------------------------------------------
    // Stage semantics
    // ------------------------------------------------------------------

    @Test
    void notebooks_onlyForLessonsWithCoding() {
        // mock curriculum types cycle theory, hands-on, mixed
        fixture = new PipelineFixture(output, 3);
        GenerationJob job = TestJobs.job("Rust");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        List<ArtifactRecord> notebooks = fixture.records(StageName.NOTEBOOKS);
        assertThat(notebooks).singleElement()
                .satisfies(r -> assertThat(r.getLessonNumber()).isEqualTo(2));
        assertThat(fixture.records(StageName.LESSON_CONTENT)).hasSize(3);
    }

    @Test
    void completedJob_hasProgress100AndArchiveReference() {
        fixture = new PipelineFixture(output, 1);
        GenerationJob job = TestJobs.job("SQL");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getResultReference()).endsWith(".zip");
        assertThat(Path.of(job.getResultReference())).exists();
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(fixture.records(StageName.PACKAGE)).hasSize(1);
    }

    @Test
    void failingTextProvider_degradesButStillCompletes() {
        fixture = new PipelineFixture(output, 2);
        fixture.text = new FailingText();
        GenerationJob job = TestJobs.job("Haskell");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(fixture.records(StageName.PLAN_CURRICULUM)).singleElement()
                .satisfies(r -> {
                    assertThat(r.getProviderUsed()).isEqualTo("curriculum-template");
                    assertThat(r.isDegraded()).isTrue();
                });
        assertThat(fixture.records(StageName.LESSON_CONTENT))
                .hasSize(2)
                .allSatisfy(r -> assertThat(r.getTier()).isEqualTo(2));
    }

    // ------------------------------------------------------------------
    // Job-fatal paths
    // ------------------------------------------------------------------

    @Test
    void packagingFailure_failsJobBelow100() throws Exception {
        fixture = new PipelineFixture(output, 1);
        fixture.packager = mock(CoursePackager.class);
        when(fixture.packager.build(any())).thenThrow(new PackagingException("disk full"));
        GenerationJob job = TestJobs.job("Go");

        fixture.orchestrator().run(fixture.machine(job), new CancellationToken());

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getProgress()).isEqualTo(StageName.PACKAGE.progressOnEntry()).isLessThan(100);
        assertThat(job.getErrorMessage()).contains("Packaging failed").contains("disk full");
        assertThat(job.getResultReference()).isNull();
    }

    @Test
    void cancelledBeforeStart_failsWithCancellationMessage() {
        fixture = new PipelineFixture(output, 2);
        CancellationToken token = new CancellationToken();
        token.cancel("Cancelled by user");
        GenerationJob job = TestJobs.job("Go");

        fixture.orchestrator().run(fixture.machine(job), token);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Cancelled by user");
        assertThat(job.getProgress()).isZero();
        assertThat(fixture.records).isEmpty();
    }

    @Test
    void cancelledMidRun_stopsBeforePackaging() {
        fixture = new PipelineFixture(output, 4);
        CancellationToken token = new CancellationToken();
        fixture.text = new CancellingText(fixture.text, token, 3);
        GenerationJob job = TestJobs.job("Kotlin");

        fixture.orchestrator().run(fixture.machine(job), token);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Cancelled mid-run");
        assertThat(job.getProgress()).isLessThan(100);
        // the curriculum call and two lesson calls ran; no later stage did
        assertThat(fixture.records(StageName.LESSON_CONTENT)).isEmpty();
        assertThat(fixture.records(StageName.PACKAGE)).isEmpty();
    }

    @Test
    void runningAJobThatAlreadyStarted_isRejected() {
        fixture = new PipelineFixture(output, 1);
        GenerationJob job = TestJobs.job("Go", JobStatus.PROCESSING);
        JobStateMachine machine = fixture.machine(job);
        PipelineOrchestrator orchestrator = fixture.orchestrator();

        assertThatThrownBy(() -> orchestrator.run(machine, new CancellationToken()))
                .isInstanceOf(JobTransitionException.class);
    }

    // ------------------------------------------------------------------
    // Text providers
    // ------------------------------------------------------------------

    static final class FailingText implements TextProvider {
        @Override public String name() { return "down"; }

        @Override
        public String generate(Prompt prompt) {
            throw new IllegalStateException("connection refused");
        }
    }

    /** Delegates, and cancels the token on the n-th call. */
    static final class CancellingText implements TextProvider {
        private final TextProvider      delegate;
        private final CancellationToken token;
        private final int               cancelOnCall;
        private final AtomicInteger     calls = new AtomicInteger();

        CancellingText(TextProvider delegate, CancellationToken token, int cancelOnCall) {
            this.delegate     = delegate;
            this.token        = token;
            this.cancelOnCall = cancelOnCall;
        }

        @Override public String name() { return delegate.name(); }

        @Override
        public String generate(Prompt prompt) {
            if (calls.incrementAndGet() == cancelOnCall) token.cancel("Cancelled mid-run");
            return delegate.generate(prompt);
        }
    }
}
