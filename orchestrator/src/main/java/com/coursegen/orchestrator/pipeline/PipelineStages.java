package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.stage.BackgroundImageStage;
import com.coursegen.orchestrator.stage.CourseDescriptionStage;
import com.coursegen.orchestrator.stage.CurriculumPlanner;
import com.coursegen.orchestrator.stage.FinalVideoStage;
import com.coursegen.orchestrator.stage.LessonContentStage;
import com.coursegen.orchestrator.stage.NotebookStage;
import com.coursegen.orchestrator.stage.PresenterVideoStage;
import com.coursegen.orchestrator.stage.SpeechScriptStage;
import com.coursegen.orchestrator.stage.ThumbnailStage;

/**
 * The nine producing stages; the tenth (packaging) is the orchestrator's own.
 */
public record PipelineStages(
        CurriculumPlanner      curriculum,
        LessonContentStage     content,
        CourseDescriptionStage description,
        SpeechScriptStage      scripts,
        NotebookStage          notebooks,
        BackgroundImageStage   backgrounds,
        ThumbnailStage         thumbnail,
        PresenterVideoStage    presenterVideos,
        FinalVideoStage        finalVideos
) {}
