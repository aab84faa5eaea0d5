package com.coursegen.orchestrator.content;

import com.coursegen.orchestrator.model.LessonSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Deterministic lesson content, keyed only by the lesson title. Terminal
 * producer of the lesson-content chain, so it must never fail.
 */
public final class LessonTemplates {

    /** Keys every lesson content object (provider or template) carries. */
    public static final List<String> REQUIRED_KEYS = List.of(
            "title", "introduction", "theory_content", "examples",
            "key_takeaways", "summary", "exercises");

    /** Keys a provider answer must have before lesson metadata is stamped on. */
    public static final List<String> PROVIDER_KEYS = List.of("introduction");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LessonTemplates() {}

    public static ObjectNode lessonContent(ObjectMapper mapper, String title) {
        String t = (title == null || title.isBlank()) ? "Untitled lesson" : title;

        ObjectNode root = mapper.createObjectNode();
        root.put("title", t);
        root.put("introduction", "Welcome to this lesson on " + t + ". "
                + "We will cover the fundamental concepts and practical applications.");

        ObjectNode theory = root.putObject("theory_content");
        theory.putArray("main_concepts").add("Core principles of " + t).add("Key terminology").add("Common use cases");
        theory.put("explanations", t + " builds on a small number of core ideas. "
                + "This lesson introduces each one and shows where it applies.");

        ArrayNode examples = root.putArray("examples");
        examples.addObject()
                .put("title", "A first look at " + t)
                .put("description", "A short walkthrough of the basic workflow.");

        root.putArray("key_takeaways")
                .add("Understand the core concepts of " + t)
                .add("Recognize where " + t + " applies in practice")
                .add("Know the next topics to study");
        root.put("summary", "This lesson introduced " + t + " and its key concepts.");

        ArrayNode exercises = root.putArray("exercises");
        exercises.addObject()
                .put("title", "Review exercise")
                .put("description", "Summarize the main ideas of " + t + " in your own words.")
                .put("difficulty", "easy");
        return root;
    }

    /**
     * Overwrites the lesson-identifying fields so downstream stages never depend
     * on what the provider chose to echo back.
     */
    public static ObjectNode withLessonMetadata(ObjectNode content, LessonSpec lesson) {
        content.put("lesson_number", lesson.number());
        content.put("title", lesson.title());
        content.put("type", lesson.type().label());
        content.put("duration_minutes", lesson.durationMinutes());
        content.put("has_coding", lesson.hasCoding());
        ArrayNode objectives = content.putArray("learning_objectives");
        lesson.learningObjectives().forEach(objectives::add);
        ObjectNode template = null;
        for (String key : REQUIRED_KEYS) {
            if (content.has(key)) continue;
            if (template == null) template = lessonContent(MAPPER, lesson.title());
            content.set(key, template.get(key));
        }
        return content;
    }
}
