package com.coursegen.orchestrator.content;

import com.coursegen.orchestrator.model.LessonSpec;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Templated speech scripts and script timing.
 *
 * Scripts may carry stage-direction cues such as {@code [PAUSE:2s]} or
 * {@code [EMPHASIS]}; cues are not spoken.
 */
public final class ScriptTemplates {

    public static final int WORDS_PER_MINUTE = 150;

    private static final Pattern CUE   = Pattern.compile("\\[[A-Z_]+(?::[^\\]]*)?]");
    private static final Pattern PAUSE = Pattern.compile("\\[PAUSE:(\\d+(?:\\.\\d+)?)s]");

    private ScriptTemplates() {}

    public static String fallbackScript(LessonSpec lesson, JsonNode content) {
        String intro = text(content, "introduction",
                "In this lesson we explore " + lesson.title() + ".");
        String summary = text(content, "summary",
                "That wraps up our look at " + lesson.title() + ".");

        StringBuilder sb = new StringBuilder();
        sb.append("[INTRO_MUSIC] Welcome to lesson ").append(lesson.number())
          .append(": ").append(lesson.title()).append(". [PAUSE:2s]\n\n");
        sb.append(intro).append(" [PAUSE:1s]\n\n");

        JsonNode takeaways = content == null ? null : content.get("key_takeaways");
        if (takeaways != null && takeaways.isArray() && !takeaways.isEmpty()) {
            sb.append("[EMPHASIS] Here are the key points to remember. [PAUSE:1s]\n");
            takeaways.forEach(t -> sb.append(t.asText()).append(". [PAUSE:1s]\n"));
            sb.append('\n');
        }
        if (lesson.hasCoding()) {
            sb.append("Open the companion notebook for this lesson and work through the exercises. [PAUSE:2s]\n\n");
        }
        sb.append(summary).append(" [PAUSE:2s]\n\n");
        sb.append("Thanks for watching, see you in the next lesson. [OUTRO_MUSIC]");
        return sb.toString();
    }

    /** Text with all cues removed, as handed to a speech engine. */
    public static String spokenText(String script) {
        return CUE.matcher(script).replaceAll("").replaceAll("[ \\t]+", " ").strip();
    }

    /** Speaking time at {@value #WORDS_PER_MINUTE} wpm plus explicit pauses. */
    public static double estimateDurationMinutes(String script) {
        if (script == null || script.isBlank()) return 0.0;
        String spoken = spokenText(script);
        int words = spoken.isEmpty() ? 0 : spoken.split("\\s+").length;
        double pauseSeconds = 0;
        Matcher m = PAUSE.matcher(script);
        while (m.find()) {
            pauseSeconds += Double.parseDouble(m.group(1));
        }
        return (double) words / WORDS_PER_MINUTE + pauseSeconds / 60.0;
    }

    private static String text(JsonNode node, String field, String fallback) {
        if (node == null) return fallback;
        JsonNode v = node.get(field);
        return v != null && v.isTextual() && !v.asText().isBlank() ? v.asText() : fallback;
    }
}
