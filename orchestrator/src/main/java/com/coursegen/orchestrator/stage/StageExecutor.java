package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;

/**
 * Runs one per-lesson stage for one lesson, through the fallback chain for
 * that stage's artifact type. Driven by
 * {@link com.coursegen.orchestrator.pipeline.BatchRunner}.
 */
public interface StageExecutor<T> {

    StageName stage();

    /** Lessons this returns false for are left out of the stage's output on purpose. */
    default boolean appliesTo(LessonSpec lesson, CourseData course) {
        return true;
    }

    StageArtifact<T> execute(LessonSpec lesson, CourseData course);

    /** True if producing {@code artifact} cost a call to a rate-limited provider. */
    default boolean pacesAfter(StageArtifact<T> artifact) {
        return false;
    }
}
