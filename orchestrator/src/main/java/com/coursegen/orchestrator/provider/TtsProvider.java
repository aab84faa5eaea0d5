package com.coursegen.orchestrator.provider;

/**
 * Neural text-to-speech provider.
 */
public interface TtsProvider {

    String name();

    /** File extension of the audio this provider returns, e.g. "mp3". */
    String audioFormat();

    /** @throws ProviderException on any failure, classified by kind */
    byte[] synthesize(String text);
}
