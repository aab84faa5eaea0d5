package com.coursegen.orchestrator.content;

import com.coursegen.orchestrator.model.LessonSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds and writes Jupyter notebooks (nbformat 4) for coding lessons.
 */
public class NotebookWriter {

    private final ObjectMapper objectMapper;

    public NotebookWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Notebook with the lesson's code examples, exercises and a solutions section.
     *
     * @return null if the content has neither code examples nor exercises
     */
    public ObjectNode full(LessonSpec lesson, JsonNode content) {
        JsonNode examples  = content.path("code_examples");
        JsonNode exercises = content.path("exercises");
        if (!hasItems(examples) && !hasItems(exercises)) {
            return null;
        }

        ObjectNode nb = skeleton();
        ArrayNode cells = (ArrayNode) nb.get("cells");
        markdown(cells, "# Lesson " + lesson.number() + ": " + lesson.title() + "\n\n"
                + content.path("introduction").asText(""));

        if (hasItems(examples)) {
            markdown(cells, "## Code examples");
            for (JsonNode ex : examples) {
                markdown(cells, "### " + ex.path("title").asText("Example") + "\n\n"
                        + ex.path("description").asText(""));
                code(cells, ex.path("code").asText("# example code"));
                if (ex.hasNonNull("explanation")) markdown(cells, ex.get("explanation").asText());
            }
        }

        if (hasItems(exercises)) {
            markdown(cells, "## Exercises");
            int n = 1;
            for (JsonNode ex : exercises) {
                StringBuilder md = new StringBuilder("### Exercise " + n++ + ": " + ex.path("title").asText("") + "\n\n")
                        .append(ex.path("description").asText(""));
                JsonNode hints = ex.path("hints");
                if (hasItems(hints)) {
                    md.append("\n\n**Hints:**\n");
                    hints.forEach(h -> md.append("- ").append(h.asText()).append('\n'));
                }
                markdown(cells, md.toString());
                code(cells, "# Your code here\n");
            }

            markdown(cells, "## Solutions");
            n = 1;
            for (JsonNode ex : exercises) {
                String solution = ex.path("solution").asText("");
                if (solution.isBlank()) { n++; continue; }
                markdown(cells, "### Solution " + n++);
                code(cells, solution);
            }
        }

        markdown(cells, "## Summary\n\n" + content.path("summary").asText(""));
        return nb;
    }

    /** Title, introduction and one empty code cell. Never fails. */
    public ObjectNode minimal(LessonSpec lesson) {
        ObjectNode nb = skeleton();
        ArrayNode cells = (ArrayNode) nb.get("cells");
        markdown(cells, "# Lesson " + lesson.number() + ": " + lesson.title() + "\n\n"
                + "Use this notebook to practise the ideas from the lesson.");
        code(cells, "# Your code here\n");
        return nb;
    }

    public Path write(ObjectNode notebook, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), notebook);
        return target;
    }

    public static String fileName(LessonSpec lesson) {
        return "lesson_" + lesson.id().padded() + ".ipynb";
    }

    // ------------------------------------------------------------------

    private ObjectNode skeleton() {
        ObjectNode nb = objectMapper.createObjectNode();
        nb.putArray("cells");
        ObjectNode meta = nb.putObject("metadata");
        meta.putObject("kernelspec")
            .put("display_name", "Python 3")
            .put("language", "python")
            .put("name", "python3");
        meta.putObject("language_info").put("name", "python");
        nb.put("nbformat", 4);
        nb.put("nbformat_minor", 5);
        return nb;
    }

    private static void markdown(ArrayNode cells, String source) {
        ObjectNode cell = cells.addObject();
        cell.put("cell_type", "markdown");
        cell.putObject("metadata");
        cell.put("source", source);
    }

    private static void code(ArrayNode cells, String source) {
        ObjectNode cell = cells.addObject();
        cell.put("cell_type", "code");
        cell.putNull("execution_count");
        cell.putObject("metadata");
        cell.putArray("outputs");
        cell.put("source", source);
    }

    private static boolean hasItems(JsonNode node) {
        return node != null && node.isArray() && !node.isEmpty();
    }
}
