package com.coursegen.orchestrator.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Output directory of one job.
 *
 * Named {@code course_package_<topic>_<yyyyMMdd_HHmmss>_<job id prefix>}: the
 * topic part is sanitized for any filesystem and the job id prefix keeps two
 * concurrent jobs on the same topic apart even within the same second.
 */
public final class JobWorkspace {

    public static final String SCRIPTS     = "scripts";
    public static final String NOTEBOOKS   = "notebooks";
    public static final String BACKGROUNDS = "backgrounds";
    public static final String VIDEOS      = "videos";
    public static final String MARKETING   = "marketing";
    public static final String RESOURCES   = "resources";
    public static final String ASSESSMENTS = "assessments";
    /** Intermediate files (audio, raw presenter clips); removed before archiving. */
    public static final String WORK        = "work";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_TOPIC_CHARS = 50;

    private final Path root;

    private JobWorkspace(Path root) {
        this.root = root;
    }

    public static JobWorkspace create(Path outputDir, String topic, UUID jobId, Clock clock) {
        String name = "course_package_%s_%s_%s".formatted(
                sanitize(topic),
                LocalDateTime.now(clock).format(STAMP),
                jobId.toString().substring(0, 8));
        Path root = outputDir.resolve(name);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create job workspace " + root, e);
        }
        return new JobWorkspace(root);
    }

    /** Lower-case ASCII letters, digits and underscores only; never empty. */
    public static String sanitize(String topic) {
        String s = topic == null ? "" : topic.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (s.length() > MAX_TOPIC_CHARS) s = s.substring(0, MAX_TOPIC_CHARS).replaceAll("_+$", "");
        return s.isEmpty() ? "course" : s;
    }

    public Path root() {
        return root;
    }

    /** Sub-directory of the package, created on first use. */
    public Path dir(String name) {
        Path dir = root.resolve(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + dir, e);
        }
        return dir;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
