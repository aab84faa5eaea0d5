package com.coursegen.orchestrator.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContentRepairerTest {

    final ObjectMapper    mapper   = new ObjectMapper();
    final ContentRepairer repairer = new ContentRepairer(mapper);

    @Test
    void validJson_isReturnedExactlyAsParsed() throws Exception {
        String json = """
                {"title":"Loops","introduction":"Say \\"hi\\"","examples":[{"code":"for x in y:\\n    pass"}]}
                """;

        ContentRepairer.Repaired result = repairer.repair(json, "Loops");

        assertThat(result.method()).isEqualTo(ContentRepairer.Method.PARSED);
        assertThat(result.value()).isEqualTo(mapper.readTree(json));
    }

    @Test
    void codeFencesAndSurroundingProse_areStripped() throws Exception {
        String raw = """
                Sure! Here is the lesson:
                ```json
                {"title": "Loops", "introduction": "Intro"}
                ```
                Let me know if you need more.
                """;

        Optional<ObjectNode> result = repairer.tryRepair(raw);

        assertThat(result).contains((ObjectNode) mapper.readTree("{\"title\":\"Loops\",\"introduction\":\"Intro\"}"));
    }

    @Test
    void unescapedNewlineInsideString_isRepaired() {
        String raw = "{\n"
                + "  \"title\": \"Loops\",\n"
                + "  \"introduction\": \"Line one\n"
                + "line two\",\n"
                + "  \"summary\": \"ok\"\n"
                + "}";

        ContentRepairer.Repaired result = repairer.repair(raw, "Loops");

        assertThat(result.method()).isEqualTo(ContentRepairer.Method.REPAIRED);
        assertThat(result.value().get("introduction").asText()).isEqualTo("Line one\nline two");
        assertThat(result.value().get("summary").asText()).isEqualTo("ok");
    }

    @Test
    void repairedObjectWithoutRequiredKeys_isDiscarded() {
        String raw = "{\"title\": \"Loops\", \"notes\": \"first\nsecond\"}";

        assertThat(repairer.tryRepair(raw, List.of("introduction"))).isEmpty();
        // without a schema requirement the same repair is accepted
        assertThat(repairer.tryRepair(raw)).isPresent();
    }

    @Test
    void irrecoverableInput_fallsBackToTemplateWithoutThrowing() {
        ContentRepairer.Repaired result = repairer.repair("I'm sorry, I can't produce JSON today.", "Recursion");

        assertThat(result.method()).isEqualTo(ContentRepairer.Method.TEMPLATE);
        LessonTemplates.REQUIRED_KEYS.forEach(key -> assertThat(result.value().has(key)).as(key).isTrue());
        assertThat(result.value().get("title").asText()).isEqualTo("Recursion");
    }

    @Test
    void nullAndBlankInput_fallBackToTemplate() {
        assertThat(repairer.repair(null, "A").method()).isEqualTo(ContentRepairer.Method.TEMPLATE);
        assertThat(repairer.repair("   ", "A").method()).isEqualTo(ContentRepairer.Method.TEMPLATE);
        assertThat(repairer.tryRepair(null)).isEmpty();
    }

    @Test
    void controlCharacters_areRemoved() {
        assertThat(ContentRepairer.removeControlCharacters("a\u0000b\u0007c\td\ne"))
                .isEqualTo("abc\td\ne");
    }

    @Test
    void jsonArray_isNotAcceptedAsAnObject() {
        assertThat(repairer.tryRepair("[1, 2, 3]")).isEmpty();
    }
}
