package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.packaging.CoursePackager;
import com.coursegen.orchestrator.packaging.PackageResult;
import com.coursegen.orchestrator.packaging.PackagingException;
import com.coursegen.orchestrator.repository.ArtifactRecordRepository;
import com.coursegen.orchestrator.service.JobStateMachine;
import com.coursegen.orchestrator.stage.SpeechScript;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Drives one job through the ten stages in order.
 *
 * Stage failures never reach here: every chain ends in a local template
 * producer and {@link BatchRunner} isolates lesson-level exceptions. What
 * fails a job is a packaging error, a cancellation, or an unexpected error
 * outside any chain (the workspace cannot be created, say).
 *
 * <pre>
 *   start ─▶ [check token, advance, run stage, record artifacts] × 10 ─▶ complete
 *                              └── cancelled / packaging / unexpected ─▶ fail
 * </pre>
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final int MAX_SUMMARY_CHARS = 200;

    private final PipelineStages           stages;
    private final BatchRunner              batch;
    private final CoursePackager           packager;
    private final ArtifactRecordRepository artifacts;
    private final CourseGenProperties      props;
    private final Clock                    clock;

    public PipelineOrchestrator(PipelineStages stages,
                                BatchRunner batch,
                                CoursePackager packager,
                                ArtifactRecordRepository artifacts,
                                CourseGenProperties props,
                                Clock clock) {
        this.stages    = stages;
        this.batch     = batch;
        this.packager  = packager;
        this.artifacts = artifacts;
        this.props     = props;
        this.clock     = clock;
    }

    /**
     * Runs the job to a terminal state. The job must be PENDING.
     */
    public void run(JobStateMachine job, CancellationToken token) {
        GenerationJob entity = job.job();
        MDC.put("jobId", String.valueOf(entity.getId()));
        try {
            job.start();
            Instant started = clock.instant();
            StageName current = null;
            try {
                token.throwIfCancelled();
                JobWorkspace workspace = JobWorkspace.create(
                        props.outputDir(), entity.getTopic(), entity.getId(), clock);
                CourseData course = new CourseData(
                        entity.getId(), entity.getTopic(), entity.getDocumentIds(), workspace);
                log.info("Generating course '{}' into {}", entity.getTopic(), workspace);

                current = enter(job, StageName.PLAN_CURRICULUM, token);
                course.setCurriculum(record(course, stages.curriculum().execute(course)));

                current = enter(job, StageName.LESSON_CONTENT, token);
                course.setContent(recordAll(course, batch.run(stages.content(), course, token)));

                current = enter(job, StageName.COURSE_DESCRIPTION, token);
                course.setDescription(record(course, stages.description().execute(course)));

                current = enter(job, StageName.SPEECH_SCRIPTS, token);
                course.setScripts(recordAll(course, batch.run(stages.scripts(), course, token)));

                current = enter(job, StageName.NOTEBOOKS, token);
                course.setNotebooks(recordAll(course, batch.run(stages.notebooks(), course, token)));

                current = enter(job, StageName.BACKGROUND_IMAGES, token);
                course.setBackgrounds(recordAll(course, batch.run(stages.backgrounds(), course, token)));

                current = enter(job, StageName.COURSE_THUMBNAIL, token);
                course.setThumbnail(record(course, stages.thumbnail().execute(course)));

                current = enter(job, StageName.PRESENTER_VIDEOS, token);
                course.setPresenterVideos(recordAll(course, batch.run(stages.presenterVideos(), course, token)));

                current = enter(job, StageName.FINAL_VIDEOS, token);
                course.setFinalVideos(recordAll(course, batch.run(stages.finalVideos(), course, token)));

                current = enter(job, StageName.PACKAGE, token);
                PackageResult result = packager.build(course);
                recordPackage(course, result, started);

                MDC.remove("stage");
                job.complete(result.archive().toString());
                log.info("Course '{}' done in {} s", course.courseTitle(),
                        Duration.between(started, clock.instant()).toSeconds());
            } catch (JobCancelledException e) {
                failCancelled(job, token);
            } catch (PackagingException e) {
                clearInterrupt();
                job.fail("Packaging failed: " + e.getMessage());
            } catch (RuntimeException e) {
                if (token.isCancelled()) {
                    failCancelled(job, token);
                } else {
                    clearInterrupt();
                    log.error("Unexpected error in {}", current, e);
                    job.fail("Unexpected error" + (current == null ? "" : " in " + current) + ": " + e);
                }
            }
        } finally {
            MDC.remove("stage");
            MDC.remove("jobId");
        }
    }

    private StageName enter(JobStateMachine job, StageName stage, CancellationToken token) {
        token.throwIfCancelled();
        MDC.put("stage", stage.name());
        job.advance(stage.progressOnEntry());
        log.info("Stage {}/{} {}", stage.position(), StageName.values().length, stage);
        return stage;
    }

    private void failCancelled(JobStateMachine job, CancellationToken token) {
        // a cancel may have interrupted this worker; the final save must not see that
        clearInterrupt();
        job.fail(token.reason());
    }

    private static void clearInterrupt() {
        Thread.interrupted();
    }

    // ------------------------------------------------------------------
    // Artifact records
    // ------------------------------------------------------------------

    private <T> StageArtifact<T> record(CourseData course, StageArtifact<T> artifact) {
        save(course, List.of(artifact));
        return artifact;
    }

    private <T> LessonArtifacts<T> recordAll(CourseData course, LessonArtifacts<T> lessonArtifacts) {
        save(course, lessonArtifacts.artifacts());
        return lessonArtifacts;
    }

    private void save(CourseData course, Collection<? extends StageArtifact<?>> produced) {
        if (produced.isEmpty()) return;
        artifacts.saveAll(produced.stream()
                .map(a -> new ArtifactRecord(course.jobId(), a, summarize(course, a.value())))
                .toList());
        long degraded = produced.stream().filter(StageArtifact::degraded).count();
        if (degraded > 0) {
            log.warn("{} of {} artifacts degraded", degraded, produced.size());
        }
    }

    private void recordPackage(CourseData course, PackageResult result, Instant started) {
        StageArtifact<Path> artifact = new StageArtifact<>(LessonId.COURSE, StageName.PACKAGE,
                result.archive(), "course-packager", 1, 1, !result.validation().isValid(),
                result.validation().failedChecks(), clock.instant());
        save(course, List.of(artifact));
        log.info("Packaged {} ({}/{} checks) after {} s", result.archive().getFileName(),
                result.validation().passedChecks(), result.validation().totalChecks(),
                Duration.between(started, clock.instant()).toSeconds());
    }

    String summarize(CourseData course, Object value) {
        String text;
        if (value instanceof Path p) {
            text = relative(course, p);
        } else if (value instanceof SpeechScript s) {
            text = relative(course, s.file()) + " (~%.1f min)".formatted(s.estimatedMinutes());
        } else if (value instanceof Curriculum c) {
            text = "%s: %d lessons".formatted(c.courseTitle(), c.lessons().size());
        } else if (value instanceof ObjectNode json) {
            text = json.path("title").asText("lesson") + " " + fieldNames(json);
        } else {
            text = String.valueOf(value);
        }
        return text.length() <= MAX_SUMMARY_CHARS ? text : text.substring(0, MAX_SUMMARY_CHARS) + "...";
    }

    private static String relative(CourseData course, Path p) {
        if (p == null) return "";
        Path root = course.workspace().root();
        return p.startsWith(root) ? root.relativize(p).toString() : p.toString();
    }

    private static List<String> fieldNames(ObjectNode json) {
        List<String> names = new ArrayList<>();
        json.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
