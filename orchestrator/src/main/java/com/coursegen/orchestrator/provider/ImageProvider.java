package com.coursegen.orchestrator.provider;

/**
 * Generative image provider.
 */
public interface ImageProvider {

    String name();

    /**
     * @param size e.g. "1792x1024"
     * @return encoded image bytes (PNG)
     * @throws ProviderException on any failure, classified by kind
     */
    byte[] generate(Prompt prompt, String size);
}
