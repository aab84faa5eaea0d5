package com.coursegen.orchestrator.content;

import com.coursegen.orchestrator.model.Curriculum;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.provider.Prompt;
import com.coursegen.orchestrator.provider.PromptKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the prompts sent to text and image providers.
 */
public final class Prompts {

    private Prompts() {}

    public static Prompt curriculum(String topic, int lessonCount, List<UUID> documentIds) {
        String docs = documentIds.isEmpty()
                ? "No reference documents were supplied."
                : "Reference documents: " + documentIds.stream().map(UUID::toString).collect(Collectors.joining(", ")) + ".";
        String text = """
                Design a %d-lesson course on "%s". %s
                Respond with a single JSON object:
                {"course_title": "...", "difficulty": "beginner|intermediate|advanced",
                 "target_audience": "...", "learning_objectives": ["..."],
                 "lessons": [{"lesson_number": 1, "title": "...", "type": "theory|hands-on|mixed",
                              "duration_minutes": 30, "learning_objectives": ["..."]}]}
                """.formatted(lessonCount, topic, docs);
        return new Prompt(PromptKind.CURRICULUM, topic, text);
    }

    public static Prompt lessonContent(LessonSpec lesson, String courseTitle) {
        String coding = lesson.hasCoding()
                ? """
                  Include "code_examples" (title, description, code, explanation) and
                  "exercises" (title, description, hints, solution)."""
                : "Include \"exercises\" as discussion questions (title, description).";
        String text = """
                Write lesson %d of the course "%s": "%s" (%s, %d minutes).
                Learning objectives: %s
                Respond with a single JSON object with keys "introduction",
                "theory_content" (main_concepts, explanations), "examples",
                "key_takeaways", "summary". %s
                """.formatted(lesson.number(), courseTitle, lesson.title(), lesson.type().label(),
                              lesson.durationMinutes(), String.join("; ", lesson.learningObjectives()), coding);
        return new Prompt(PromptKind.LESSON_CONTENT, lesson.title(), text);
    }

    public static Prompt courseDescription(Curriculum curriculum) {
        String lessons = curriculum.lessons().stream()
                .map(l -> l.number() + ". " + l.title())
                .collect(Collectors.joining("\n"));
        String text = """
                Write a compelling two-paragraph marketing description for the %s course "%s"
                aimed at %s. Lessons:
                %s
                Respond with plain text only.
                """.formatted(curriculum.difficulty(), curriculum.courseTitle(),
                              curriculum.targetAudience(), lessons);
        return new Prompt(PromptKind.COURSE_DESCRIPTION, curriculum.courseTitle(), text);
    }

    public static Prompt speechScript(LessonSpec lesson, JsonNode content) {
        String text = """
                Write the narration for a video presenter teaching "%s".
                Use stage cues such as [PAUSE:2s] and [EMPHASIS] where helpful.
                Base it on this lesson content:
                %s
                Respond with the script text only.
                """.formatted(lesson.title(), content == null ? "{}" : content.toString());
        return new Prompt(PromptKind.SPEECH_SCRIPT, lesson.title(), text);
    }

    public static Prompt backgroundImage(LessonSpec lesson, String courseTitle) {
        String text = "A clean, professional 16:9 background for an educational video about \""
                + lesson.title() + "\" (course: " + courseTitle + "). Abstract shapes, no text, calm colours.";
        return new Prompt(PromptKind.IMAGE, lesson.title(), text);
    }

    public static Prompt thumbnail(Curriculum curriculum, String description) {
        String text = "A course thumbnail for \"" + curriculum.courseTitle() + "\", "
                + curriculum.difficulty() + " level. Bold, modern, eye-catching. Context: "
                + abbreviate(description, 300);
        return new Prompt(PromptKind.IMAGE, curriculum.courseTitle(), text);
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
