package com.coursegen.orchestrator.model;

/**
 * The ten pipeline stages, in execution order.
 *
 * Each stage consumes the aggregate output of the stages before it, so the
 * declaration order here is also the data-dependency order.
 */
public enum StageName {
    PLAN_CURRICULUM,
    LESSON_CONTENT,
    COURSE_DESCRIPTION,
    SPEECH_SCRIPTS,
    NOTEBOOKS,
    BACKGROUND_IMAGES,
    COURSE_THUMBNAIL,
    PRESENTER_VIDEOS,
    FINAL_VIDEOS,
    PACKAGE;

    // Progress is split into (stages + 1) equal parts so that only complete()
    // ever reaches 100.
    public static final int PROGRESS_INCREMENT = 100 / (values().length + 1);

    /** 1-based position in the pipeline. */
    public int position() {
        return ordinal() + 1;
    }

    /** Job progress to report on entering this stage. */
    public int progressOnEntry() {
        return position() * PROGRESS_INCREMENT;
    }
}
