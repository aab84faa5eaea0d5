package com.coursegen.orchestrator.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a local tool (ffmpeg, espeak-ng ...) with a wall-clock limit.
 *
 * Output goes to a temporary log file rather than a pipe, so a chatty tool
 * cannot block on a full pipe buffer.
 */
public final class ExternalCommand {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);

    private ExternalCommand() {}

    /**
     * @return the combined stdout/stderr of a successful run
     * @throws MediaException if the tool cannot start, exits non-zero or overruns {@code timeout}
     */
    public static String run(List<String> command, Duration timeout) {
        String tool = command.get(0);
        log.debug("Running {}", command);
        Path logFile;
        try {
            logFile = Files.createTempFile("coursegen-cmd-", ".log");
        } catch (IOException e) {
            throw new MediaException("Cannot create log file for " + tool, e);
        }

        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new MediaException(tool + " did not finish within " + timeout.toSeconds() + " s");
            }
            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new MediaException(tool + " exited with " + process.exitValue() + ": " + tail(output));
            }
            return output;
        } catch (InterruptedException e) {
            if (process != null) process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new MediaException(tool + " interrupted", e);
        } catch (IOException e) {
            throw new MediaException("Cannot run " + tool + ": " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(logFile);
            } catch (IOException e) {
                log.debug("Could not delete {}: {}", logFile, e.getMessage());
            }
        }
    }

    private static String tail(String output) {
        return output.length() <= 500 ? output : "..." + output.substring(output.length() - 500);
    }
}
