package com.coursegen.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable application configuration, bound once at startup from the
 * {@code coursegen.*} keys and passed explicitly to everything that needs it.
 *
 * Missing keys fall back to the defaults below, so tests can build a
 * complete value with {@link #defaults()}.
 */
@ConfigurationProperties(prefix = "coursegen")
public record CourseGenProperties(
        Mode      mode,
        Path      outputDir,
        int       lessonCount,
        int       workers,
        int       lessonParallelism,
        Pacing    pacing,
        Timeouts  timeouts,
        VideoPoll videoPoll,
        Retry     retry,
        ApiKeys   apiKeys,
        Speech    speech,
        Media     media,
        Presenter presenter
) {
    public enum Mode { MOCK, LIVE }

    public CourseGenProperties {
        if (mode == null)               mode = Mode.MOCK;
        if (outputDir == null)          outputDir = Path.of("output");
        if (lessonCount < 1)            lessonCount = 10;
        if (workers < 1)                workers = 2;
        if (lessonParallelism < 1)      lessonParallelism = 1;
        if (pacing == null)             pacing = new Pacing(null);
        if (timeouts == null)           timeouts = new Timeouts(null, null, null, null, null);
        if (videoPoll == null)          videoPoll = new VideoPoll(null, null);
        if (retry == null)              retry = new Retry(1);
        if (apiKeys == null)            apiKeys = new ApiKeys(null, null, null);
        if (speech == null)             speech = new Speech(null, null);
        if (media == null)              media = new Media(null);
        if (presenter == null)          presenter = new Presenter(null);
    }

    public static CourseGenProperties defaults() {
        return new CourseGenProperties(null, null, 0, 0, 0, null, null, null, null, null, null, null, null);
    }

    public boolean isLive() {
        return mode == Mode.LIVE;
    }

    /** Rate-limit delay between external calls; mock providers are never paced. */
    public Duration effectiveInterCallDelay() {
        return isLive() ? pacing.interCallDelay() : Duration.ZERO;
    }

    public CourseGenProperties withOutputDir(Path dir) {
        return new CourseGenProperties(mode, dir, lessonCount, workers, lessonParallelism, pacing,
                timeouts, videoPoll, retry, apiKeys, speech, media, presenter);
    }

    public CourseGenProperties withLessonCount(int count) {
        return new CourseGenProperties(mode, outputDir, count, workers, lessonParallelism, pacing,
                timeouts, videoPoll, retry, apiKeys, speech, media, presenter);
    }

    public record Pacing(Duration interCallDelay) {
        public Pacing {
            if (interCallDelay == null) interCallDelay = Duration.ofSeconds(30);
        }
    }

    public record Timeouts(Duration text, Duration image, Duration speech,
                           Duration videoSubmit, Duration compose) {
        public Timeouts {
            if (text == null)        text = Duration.ofSeconds(90);
            if (image == null)       image = Duration.ofSeconds(120);
            if (speech == null)      speech = Duration.ofSeconds(60);
            if (videoSubmit == null) videoSubmit = Duration.ofSeconds(30);
            if (compose == null)     compose = Duration.ofMinutes(5);
        }
    }

    /** Bounded polling of the video provider. */
    public record VideoPoll(Duration interval, Duration maxWait) {
        public VideoPoll {
            if (interval == null) interval = Duration.ofSeconds(10);
            if (maxWait == null)  maxWait = Duration.ofMinutes(5);
        }
    }

    public record Retry(int maxAttempts) {
        public Retry {
            if (maxAttempts < 1) maxAttempts = 1;
        }
    }

    public record ApiKeys(String openai, String did, String elevenlabs) {
        public ApiKeys {
            openai     = openai == null ? "" : openai.trim();
            did        = did == null ? "" : did.trim();
            elevenlabs = elevenlabs == null ? "" : elevenlabs.trim();
        }
    }

    /**
     * @param osCommand OS-native TTS executable (e.g. espeak-ng); blank disables that tier
     * @param voice     neural voice id
     */
    public record Speech(String osCommand, String voice) {
        public Speech {
            osCommand = osCommand == null ? "" : osCommand.trim();
            if (voice == null || voice.isBlank()) voice = "21m00Tcm4TlvDq8ikWAM";
        }
    }

    public record Media(String ffmpeg) {
        public Media {
            if (ffmpeg == null || ffmpeg.isBlank()) ffmpeg = "ffmpeg";
        }
    }

    /** @param avatarUrl source image handed to the video provider */
    public record Presenter(String avatarUrl) {
        public Presenter {
            if (avatarUrl == null) avatarUrl = "";
        }
    }
}
