package com.coursegen.orchestrator.media;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stand-in composer for mock mode: writes a small descriptor instead of a
 * real video, so pipelines run without ffmpeg installed.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "mock", matchIfMissing = true)
public class MockMediaComposer implements MediaComposer {

    @Override
    public String name() {
        return "mock-composer";
    }

    @Override
    public Path stillWithAudio(Path image, Path audio, Path out) {
        return write(out, "still=" + image.getFileName() + "\naudio=" + audio.getFileName() + "\n");
    }

    @Override
    public Path overlay(Path background, Path presenter, Path out) {
        return write(out, "background=" + background.getFileName() + "\npresenter=" + presenter.getFileName() + "\n");
    }

    private static Path write(Path out, String descriptor) {
        try {
            Files.createDirectories(out.getParent());
            return Files.writeString(out, "MOCK VIDEO\n" + descriptor, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MediaException("Cannot write " + out, e);
        }
    }
}
