package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.model.LessonSpec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File helpers shared by the stages.
 */
final class ArtifactFiles {

    private ArtifactFiles() {}

    static String name(LessonSpec lesson, String suffix) {
        return "lesson_" + lesson.id().padded() + "_" + suffix;
    }

    static Path write(Path target, byte[] bytes) {
        try {
            Files.createDirectories(target.getParent());
            return Files.write(target, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    static Path writeString(Path target, String text) {
        try {
            Files.createDirectories(target.getParent());
            return Files.writeString(target, text);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    static Path copy(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot copy " + source + " to " + target, e);
        }
    }

    static String extension(Path file, String fallback) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? fallback : name.substring(dot + 1);
    }
}
