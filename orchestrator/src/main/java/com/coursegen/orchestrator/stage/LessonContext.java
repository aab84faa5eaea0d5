package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.pipeline.CourseData;

/**
 * Input of the per-lesson fallback chains.
 */
public record LessonContext(LessonSpec lesson, CourseData course) {}
