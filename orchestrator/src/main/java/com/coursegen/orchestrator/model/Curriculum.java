package com.coursegen.orchestrator.model;

import java.util.List;

/**
 * Output of the planning stage: course-level facts plus the ordered lessons.
 */
public record Curriculum(
        String           courseTitle,
        String           difficulty,
        String           targetAudience,
        List<String>     learningObjectives,
        List<LessonSpec> lessons
) {
    public Curriculum {
        learningObjectives = learningObjectives == null ? List.of() : List.copyOf(learningObjectives);
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }

    public int totalDurationMinutes() {
        return lessons.stream().mapToInt(LessonSpec::durationMinutes).sum();
    }

    public double totalDurationHours() {
        return totalDurationMinutes() / 60.0;
    }
}
