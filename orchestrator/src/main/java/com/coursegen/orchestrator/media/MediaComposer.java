package com.coursegen.orchestrator.media;

import java.nio.file.Path;

/**
 * Local video composition.
 */
public interface MediaComposer {

    String name();

    /**
     * Video showing {@code image} for the length of {@code audio}.
     *
     * @throws MediaException if composition fails
     */
    Path stillWithAudio(Path image, Path audio, Path out);

    /**
     * Presenter video composited over a background image, keeping the presenter's audio.
     *
     * @throws MediaException if composition fails
     */
    Path overlay(Path background, Path presenter, Path out);
}
