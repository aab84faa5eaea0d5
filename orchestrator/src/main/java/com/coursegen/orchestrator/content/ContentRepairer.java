package com.coursegen.orchestrator.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Salvages the single JSON object a generative text provider was asked for.
 *
 * Steps, in order (each idempotent):
 * <ol>
 *   <li>strip code fences and any prose around the outermost braces;</li>
 *   <li>remove control characters other than tab, LF and CR;</li>
 *   <li>parse; valid JSON is returned untouched;</li>
 *   <li>otherwise un-escape pre-escaped quotes and re-escape string values
 *       that run over several lines, then parse again;</li>
 *   <li>give up: the caller uses the deterministic template.</li>
 * </ol>
 * The quote-parity scan in step 4 can mis-track string boundaries, so an
 * object produced by it is only accepted when it still has the caller's
 * required keys.
 */
public class ContentRepairer {

    private static final Logger log = LoggerFactory.getLogger(ContentRepairer.class);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final ObjectMapper objectMapper;

    public ContentRepairer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ObjectNode> tryRepair(String raw) {
        return tryRepair(raw, List.of());
    }

    /**
     * @param requiredKeys keys a heuristically repaired object must carry to be accepted
     * @return the parsed object, or empty if nothing trustworthy could be recovered
     */
    public Optional<ObjectNode> tryRepair(String raw, Collection<String> requiredKeys) {
        if (raw == null || raw.isBlank()) return Optional.empty();

        String cleaned = removeControlCharacters(stripFences(raw));
        Optional<ObjectNode> direct = parseObject(cleaned);
        if (direct.isPresent()) return direct;

        Optional<ObjectNode> repaired = parseObject(escapeMultilineStrings(cleaned));
        if (repaired.isEmpty()) {
            log.warn("JSON repair failed ({} chars): {}", raw.length(), abbreviate(cleaned));
            return Optional.empty();
        }
        List<String> missing = requiredKeys.stream().filter(k -> !repaired.get().has(k)).toList();
        if (!missing.isEmpty()) {
            log.warn("Repaired JSON is missing required keys {}, discarding it", missing);
            return Optional.empty();
        }
        log.info("Recovered malformed JSON with multi-line string repair");
        return repaired;
    }

    /** How {@link #repair} obtained its object. */
    public enum Method { PARSED, REPAIRED, TEMPLATE }

    public record Repaired(ObjectNode value, Method method) {}

    /**
     * Never throws: the lesson object parsed or repaired from {@code raw}, or
     * the deterministic lesson template for {@code lessonTitle}.
     */
    public Repaired repair(String raw, String lessonTitle) {
        if (raw != null && !raw.isBlank()) {
            String cleaned = removeControlCharacters(stripFences(raw));
            Optional<ObjectNode> direct = parseObject(cleaned);
            if (direct.isPresent()) return new Repaired(direct.get(), Method.PARSED);
        }
        return tryRepair(raw, LessonTemplates.PROVIDER_KEYS)
                .map(obj -> new Repaired(obj, Method.REPAIRED))
                .orElseGet(() -> new Repaired(LessonTemplates.lessonContent(objectMapper, lessonTitle), Method.TEMPLATE));
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    static String stripFences(String raw) {
        String s = raw.strip();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            s = firstNewline < 0 ? s.substring(3) : s.substring(firstNewline + 1);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        s = s.strip();
        int open = s.indexOf('{');
        int close = s.lastIndexOf('}');
        if (open > 0 && close > open) {
            s = s.substring(open, close + 1);
        } else if (open == 0 && close > 0 && close < s.length() - 1) {
            s = s.substring(0, close + 1);
        }
        return s;
    }

    static String removeControlCharacters(String s) {
        return CONTROL_CHARS.matcher(s).replaceAll("");
    }

    /**
     * Line scan with an "inside an open string" flag. Outside a string the flag
     * toggles on an odd count of unescaped quotes; inside one, embedded quotes
     * and tabs are escaped and the line break becomes a literal {@code \n}
     * until the quote that closes the value.
     */
    static String escapeMultilineStrings(String json) {
        String unescaped = json.replace("\\\"", "\"");
        String[] lines = unescaped.split("\n", -1);
        StringBuilder out = new StringBuilder(unescaped.length() + 32);
        boolean insideString = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) out.append(insideString ? "\\n" : "\n");

            if (insideString) {
                int close = closingQuote(line);
                if (close < 0) {
                    out.append(escapeFragment(line));
                    continue;
                }
                String rest = line.substring(close + 1);
                out.append(escapeFragment(line.substring(0, close))).append('"').append(rest);
                insideString = unescapedQuotes(rest) % 2 == 1;
            } else {
                out.append(line);
                insideString = unescapedQuotes(line) % 2 == 1;
            }
        }
        return out.toString();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<ObjectNode> parseObject(String s) {
        try {
            JsonNode node = objectMapper.readTree(s);
            return node instanceof ObjectNode obj ? Optional.of(obj) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Index of the quote ending the open value: the first one followed by , } ] : or end of line. */
    private static int closingQuote(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != '"' || isEscaped(line, i)) continue;
            String after = line.substring(i + 1).stripLeading();
            if (after.isEmpty() || ",}]:".indexOf(after.charAt(0)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static int unescapedQuotes(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '"' && !isEscaped(s, i)) count++;
        }
        return count;
    }

    private static boolean isEscaped(String s, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && s.charAt(i) == '\\'; i--) backslashes++;
        return backslashes % 2 == 1;
    }

    private static String escapeFragment(String fragment) {
        StringBuilder sb = new StringBuilder(fragment.length() + 8);
        for (int i = 0; i < fragment.length(); i++) {
            char c = fragment.charAt(i);
            switch (c) {
                case '"'  -> sb.append(isEscaped(fragment, i) ? "\"" : "\\\"");
                case '\t' -> sb.append("\\t");
                case '\r' -> { }
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
