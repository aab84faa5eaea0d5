package com.coursegen.orchestrator.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * OS-native text-to-speech through an espeak-compatible command
 * ({@code <command> -w out.wav "text"}).
 */
public class OsSpeechSynthesizer {

    private final String   command;
    private final Duration timeout;

    /** @param command executable name; blank means no OS speech engine is available */
    public OsSpeechSynthesizer(String command, Duration timeout) {
        this.command = command == null ? "" : command.trim();
        this.timeout = timeout;
    }

    public boolean isConfigured() {
        return !command.isEmpty();
    }

    public String command() {
        return command;
    }

    /** @throws MediaException if the engine fails or produces no audio */
    public Path synthesize(String text, Path outWav) {
        if (!isConfigured()) {
            throw new MediaException("No OS speech command configured");
        }
        try {
            Files.createDirectories(outWav.getParent());
            ExternalCommand.run(List.of(command, "-w", outWav.toString(), text), timeout);
            if (!Files.exists(outWav) || Files.size(outWav) == 0) {
                throw new MediaException(command + " produced no audio");
            }
            return outWav;
        } catch (IOException e) {
            throw new MediaException("Cannot write " + outWav, e);
        }
    }
}
