package com.coursegen.orchestrator.provider;

/**
 * Asynchronous talking-presenter video service: submit once, then poll.
 */
public interface VideoProvider {

    String name();

    /**
     * @param avatarRef source image or avatar identifier
     * @return provider job id
     * @throws ProviderException on any failure, classified by kind
     */
    String submit(String script, String avatarRef);

    /** @throws ProviderException when the status check itself fails */
    VideoStatus poll(String jobId);
}
