package com.coursegen.orchestrator.provider.mock;

import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.model.LessonType;
import com.coursegen.orchestrator.provider.Prompt;
import com.coursegen.orchestrator.provider.ProviderException;
import com.coursegen.orchestrator.provider.TextProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canned answers per prompt kind, shaped like real provider output.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "mock", matchIfMissing = true)
public class MockTextProvider implements TextProvider {

    private static final Pattern LESSON_COUNT = Pattern.compile("(\\d+)-lesson");
    private static final LessonType[] TYPE_CYCLE = { LessonType.THEORY, LessonType.HANDS_ON, LessonType.MIXED };

    private final ObjectMapper objectMapper;

    public MockTextProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "mock-text";
    }

    @Override
    public String generate(Prompt prompt) {
        return switch (prompt.kind()) {
            case CURRICULUM         -> toJson(curriculum(prompt));
            case LESSON_CONTENT     -> toJson(lesson(prompt.subject()));
            case COURSE_DESCRIPTION -> "Learn " + prompt.subject() + " from first principles to real projects. "
                    + "Each lesson combines a short video, worked examples and practice.";
            case SPEECH_SCRIPT      -> "Welcome! Today we look at " + prompt.subject() + ". [PAUSE:2s]\n"
                    + "[EMPHASIS] Let's get started. By the end you will know the core ideas. [PAUSE:1s]\n"
                    + "Thanks for watching.";
            case IMAGE -> throw new ProviderException(FailureKind.VALIDATION, "Text provider cannot answer image prompts");
        };
    }

    private ObjectNode curriculum(Prompt prompt) {
        Matcher m = LESSON_COUNT.matcher(prompt.text());
        int count = m.find() ? Integer.parseInt(m.group(1)) : 10;

        ObjectNode root = objectMapper.createObjectNode();
        root.put("course_title", "Complete " + prompt.subject() + " Course");
        root.put("difficulty", "intermediate");
        root.put("target_audience", "Developers and learners");
        root.putArray("learning_objectives").add("Understand concepts").add("Apply knowledge").add("Build projects");
        ArrayNode lessons = root.putArray("lessons");
        for (int i = 1; i <= count; i++) {
            ObjectNode l = lessons.addObject();
            l.put("lesson_number", i);
            l.put("title", prompt.subject() + " Topic " + i);
            l.put("type", TYPE_CYCLE[(i - 1) % TYPE_CYCLE.length].label());
            l.put("duration_minutes", 30);
            l.putArray("learning_objectives").add("Objective " + i + ".1").add("Objective " + i + ".2");
        }
        return root;
    }

    private ObjectNode lesson(String title) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("introduction", "Today we are going to learn about " + title + ".");
        ObjectNode theory = root.putObject("theory_content");
        theory.putArray("main_concepts").add("What " + title + " is").add("How it works");
        theory.put("explanations", title + " is easier than it looks once the core idea clicks.");
        root.putArray("examples").addObject()
                .put("title", title + " in practice")
                .put("description", "A real-world use of " + title + ".");
        String fn = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        root.putArray("code_examples").addObject()
                .put("title", "First " + title + " component")
                .put("description", "A minimal working example.")
                .put("code", "def " + fn + "():\n    print('Hello from " + title.replace("'", "") + "')\n")
                .put("explanation", "Calling the function prints a greeting.");
        ObjectNode exercise = root.putArray("exercises").addObject()
                .put("title", "Extend the example")
                .put("description", "Make the function take a name and greet it.")
                .put("solution", "def greet(name):\n    print(f'Hello {name}')\n");
        exercise.putArray("hints").add("Add a parameter").add("Use an f-string");
        root.putArray("key_takeaways").add(title + " solves a concrete problem").add("Practice makes it stick");
        root.put("summary", "We covered the essentials of " + title + ".");
        return root;
    }

    private String toJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ProviderException(FailureKind.PROVIDER, "Mock serialization failed", e);
        }
    }
}
