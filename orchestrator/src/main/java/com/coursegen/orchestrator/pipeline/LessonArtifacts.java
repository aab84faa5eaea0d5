package com.coursegen.orchestrator.pipeline;

import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-lesson output of one stage, ordered by lesson number.
 *
 * A lesson may be absent (not applicable to the stage, or its execution
 * failed); callers must treat absence as a normal case, hence {@link Optional}.
 */
public final class LessonArtifacts<T> {

    private final Map<LessonId, StageArtifact<T>> byLesson;

    private LessonArtifacts(Map<LessonId, StageArtifact<T>> byLesson) {
        this.byLesson = Collections.unmodifiableMap(new TreeMap<>(byLesson));
    }

    public static <T> LessonArtifacts<T> of(Map<LessonId, StageArtifact<T>> byLesson) {
        return new LessonArtifacts<>(byLesson);
    }

    public static <T> LessonArtifacts<T> empty() {
        return new LessonArtifacts<>(Map.of());
    }

    public Optional<StageArtifact<T>> get(LessonId lesson) {
        return Optional.ofNullable(byLesson.get(lesson));
    }

    public Optional<T> value(LessonId lesson) {
        return get(lesson).map(StageArtifact::value);
    }

    public boolean contains(LessonId lesson) {
        return byLesson.containsKey(lesson);
    }

    public Set<LessonId> lessons() {
        return byLesson.keySet();
    }

    public Collection<StageArtifact<T>> artifacts() {
        return byLesson.values();
    }

    public int size() {
        return byLesson.size();
    }

    public boolean isEmpty() {
        return byLesson.isEmpty();
    }

    @Override
    public String toString() {
        return "LessonArtifacts" + byLesson.keySet();
    }
}
