package com.coursegen.orchestrator.stage;

import java.nio.file.Path;

/**
 * A lesson's narration script.
 *
 * @param file             where the script was written inside the package
 * @param estimatedMinutes speaking time, see
 *                         {@link com.coursegen.orchestrator.content.ScriptTemplates#estimateDurationMinutes}
 */
public record SpeechScript(String text, Path file, double estimatedMinutes) {}
