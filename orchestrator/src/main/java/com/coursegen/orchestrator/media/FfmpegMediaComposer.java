package com.coursegen.orchestrator.media;

import com.coursegen.orchestrator.config.CourseGenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Composes videos by shelling out to ffmpeg.
 */
@Component
@ConditionalOnProperty(name = "coursegen.mode", havingValue = "live")
public class FfmpegMediaComposer implements MediaComposer {

    private static final Logger log = LoggerFactory.getLogger(FfmpegMediaComposer.class);

    private final CourseGenProperties props;

    public FfmpegMediaComposer(CourseGenProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "ffmpeg";
    }

    @Override
    public Path stillWithAudio(Path image, Path audio, Path out) {
        prepare(out);
        ExternalCommand.run(List.of(
                props.media().ffmpeg(), "-y", "-loglevel", "error",
                "-loop", "1", "-i", image.toString(),
                "-i", audio.toString(),
                "-c:v", "libx264", "-tune", "stillimage", "-pix_fmt", "yuv420p",
                "-c:a", "aac", "-b:a", "128k",
                "-shortest", out.toString()),
                props.timeouts().compose());
        return verify(out);
    }

    @Override
    public Path overlay(Path background, Path presenter, Path out) {
        prepare(out);
        ExternalCommand.run(List.of(
                props.media().ffmpeg(), "-y", "-loglevel", "error",
                "-loop", "1", "-i", background.toString(),
                "-i", presenter.toString(),
                "-filter_complex",
                "[0:v]scale=1920:1080[bg];[1:v]scale=-2:720[fg];[bg][fg]overlay=(W-w)/2:H-h[v]",
                "-map", "[v]", "-map", "1:a?",
                "-c:v", "libx264", "-pix_fmt", "yuv420p", "-c:a", "aac",
                "-shortest", out.toString()),
                props.timeouts().compose());
        return verify(out);
    }

    private static void prepare(Path out) {
        try {
            Files.createDirectories(out.getParent());
        } catch (IOException e) {
            throw new MediaException("Cannot create " + out.getParent(), e);
        }
    }

    private static Path verify(Path out) {
        try {
            if (!Files.exists(out) || Files.size(out) == 0) {
                throw new MediaException("ffmpeg produced no output at " + out);
            }
        } catch (IOException e) {
            throw new MediaException("Cannot inspect " + out, e);
        }
        log.info("Composed {}", out.getFileName());
        return out;
    }
}
