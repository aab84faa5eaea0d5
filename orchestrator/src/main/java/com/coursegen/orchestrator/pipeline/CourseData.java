package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.stage.SpeechScript;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything produced so far for one course, filled in stage by stage.
 *
 * Only the worker driving the job writes to it, and stage i+1 starts after
 * stage i has fully returned, so no synchronization is needed.
 */
public class CourseData {

    private final UUID         jobId;
    private final String       topic;
    private final List<UUID>   documentIds;
    private final JobWorkspace workspace;

    private StageArtifact<Curriculum>     curriculum;
    private LessonArtifacts<ObjectNode>   content         = LessonArtifacts.empty();
    private StageArtifact<String>         description;
    private LessonArtifacts<SpeechScript> scripts         = LessonArtifacts.empty();
    private LessonArtifacts<Path>         notebooks       = LessonArtifacts.empty();
    private LessonArtifacts<Path>         backgrounds     = LessonArtifacts.empty();
    private StageArtifact<Path>           thumbnail;
    private LessonArtifacts<Path>         presenterVideos = LessonArtifacts.empty();
    private LessonArtifacts<Path>         finalVideos     = LessonArtifacts.empty();

    public CourseData(UUID jobId, String topic, List<UUID> documentIds, JobWorkspace workspace) {
        this.jobId       = jobId;
        this.topic       = topic;
        this.documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        this.workspace   = workspace;
    }

    public UUID jobId()              { return jobId; }
    public String topic()            { return topic; }
    public List<UUID> documentIds()  { return documentIds; }
    public JobWorkspace workspace()  { return workspace; }

    /** @throws IllegalStateException before the curriculum is planned */
    public Curriculum curriculum() {
        if (curriculum == null) throw new IllegalStateException("Curriculum not planned yet");
        return curriculum.value();
    }

    public List<LessonSpec> lessons() {
        return curriculum().lessons();
    }

    public String courseTitle() {
        return curriculum == null ? topic : curriculum.value().courseTitle();
    }

    /** Course description, or empty if that stage has not run. */
    public Optional<String> description() {
        return Optional.ofNullable(description).map(StageArtifact::value);
    }

    public Optional<Path> thumbnail() {
        return Optional.ofNullable(thumbnail).map(StageArtifact::value);
    }

    public StageArtifact<Curriculum> curriculumArtifact()       { return curriculum; }
    public StageArtifact<String> descriptionArtifact()          { return description; }
    public StageArtifact<Path> thumbnailArtifact()              { return thumbnail; }
    public LessonArtifacts<ObjectNode> content()                { return content; }
    public LessonArtifacts<SpeechScript> scripts()              { return scripts; }
    public LessonArtifacts<Path> notebooks()                    { return notebooks; }
    public LessonArtifacts<Path> backgrounds()                  { return backgrounds; }
    public LessonArtifacts<Path> presenterVideos()              { return presenterVideos; }
    public LessonArtifacts<Path> finalVideos()                  { return finalVideos; }

    public void setCurriculum(StageArtifact<Curriculum> curriculum)         { this.curriculum = curriculum; }
    public void setContent(LessonArtifacts<ObjectNode> content)             { this.content = content; }
    public void setDescription(StageArtifact<String> description)           { this.description = description; }
    public void setScripts(LessonArtifacts<SpeechScript> scripts)           { this.scripts = scripts; }
    public void setNotebooks(LessonArtifacts<Path> notebooks)               { this.notebooks = notebooks; }
    public void setBackgrounds(LessonArtifacts<Path> backgrounds)           { this.backgrounds = backgrounds; }
    public void setThumbnail(StageArtifact<Path> thumbnail)                 { this.thumbnail = thumbnail; }
    public void setPresenterVideos(LessonArtifacts<Path> presenterVideos)   { this.presenterVideos = presenterVideos; }
    public void setFinalVideos(LessonArtifacts<Path> finalVideos)           { this.finalVideos = finalVideos; }

    /** Every artifact produced so far, course-level first, then by stage and lesson. */
    public List<StageArtifact<?>> allArtifacts() {
        List<StageArtifact<?>> all = new ArrayList<>();
        if (curriculum != null)  all.add(curriculum);
        all.addAll(content.artifacts());
        if (description != null) all.add(description);
        all.addAll(scripts.artifacts());
        all.addAll(notebooks.artifacts());
        all.addAll(backgrounds.artifacts());
        if (thumbnail != null)   all.add(thumbnail);
        all.addAll(presenterVideos.artifacts());
        all.addAll(finalVideos.artifacts());
        return all;
    }
}
