package com.coursegen.orchestrator.provider;

/**
 * Generative text provider (an LLM chat endpoint).
 */
public interface TextProvider {

    String name();

    /** @throws ProviderException on any failure, classified by kind */
    String generate(Prompt prompt);
}
