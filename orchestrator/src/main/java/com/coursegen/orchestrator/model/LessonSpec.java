package com.coursegen.orchestrator.model;

import java.util.List;

/**
 * One planned lesson. Immutable once the curriculum is planned.
 */
public record LessonSpec(
        LessonId     id,
        String       title,
        LessonType   type,
        int          durationMinutes,
        List<String> learningObjectives
) {
    public LessonSpec {
        if (id == null || id.isCourseLevel()) {
            throw new IllegalArgumentException("A lesson needs a 1-based lesson number");
        }
        if (title == null || title.isBlank()) {
            title = "Lesson " + id.number();
        }
        if (type == null) type = LessonType.MIXED;
        learningObjectives = learningObjectives == null ? List.of() : List.copyOf(learningObjectives);
    }

    public boolean hasCoding() {
        return type.hasCoding();
    }

    public int number() {
        return id.number();
    }
}
