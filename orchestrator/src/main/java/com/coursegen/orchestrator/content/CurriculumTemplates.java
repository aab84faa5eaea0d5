package com.coursegen.orchestrator.content;

import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.model.LessonType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic curriculum used when planning through the text provider fails.
 */
public final class CurriculumTemplates {

    public static final int LESSON_MINUTES = 30;

    private static final String[] TITLES = {
            "Introduction to %s",
            "Core Concepts of %s",
            "Setting Up a %s Environment",
            "Building Your First %s Project",
            "Working with Data in %s",
            "Testing and Debugging %s Code",
            "Integrating %s with Other Systems",
            "Advanced %s Techniques",
            "%s Case Study",
            "Capstone Project: %s in Practice",
    };

    // two theory lessons, then practice; the case study mixes both
    private static final LessonType[] TYPES = {
            LessonType.THEORY, LessonType.THEORY,
            LessonType.HANDS_ON, LessonType.HANDS_ON, LessonType.HANDS_ON,
            LessonType.HANDS_ON, LessonType.HANDS_ON, LessonType.HANDS_ON,
            LessonType.MIXED, LessonType.HANDS_ON,
    };

    private CurriculumTemplates() {}

    public static Curriculum fallback(String topic, int lessonCount) {
        String t = (topic == null || topic.isBlank()) ? "Software" : topic.strip();
        int count = Math.max(1, lessonCount);

        List<LessonSpec> lessons = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            // beyond the tenth lesson, keep cycling through the practical ones
            int slot = i < TITLES.length ? i : 2 + (i - 2) % (TITLES.length - 2);
            String title = TITLES[slot].formatted(t);
            if (i >= TITLES.length) title = title + " (Part " + (i / (TITLES.length - 2) + 1) + ")";
            lessons.add(new LessonSpec(LessonId.of(i + 1), title, TYPES[slot], LESSON_MINUTES, List.of(
                    "Explain the ideas behind " + title.toLowerCase(Locale.ROOT),
                    "Apply them in a realistic " + t + " setting",
                    "Identify common mistakes and how to avoid them")));
        }

        return new Curriculum(
                "Complete " + t + " Course",
                "intermediate",
                "Developers and learners who want a practical grounding in " + t,
                List.of("Understand the foundations of " + t,
                        "Build working " + t + " projects",
                        "Apply " + t + " confidently in production settings"),
                lessons);
    }
}
