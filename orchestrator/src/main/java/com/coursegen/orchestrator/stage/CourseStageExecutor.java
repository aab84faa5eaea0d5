package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.pipeline.CourseData;

/**
 * A stage that runs once per course rather than per lesson.
 */
public interface CourseStageExecutor<T> {

    StageName stage();

    StageArtifact<T> execute(CourseData course);
}
