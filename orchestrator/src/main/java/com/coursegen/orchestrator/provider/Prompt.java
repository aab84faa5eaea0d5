package com.coursegen.orchestrator.provider;

/**
 * A prompt for a generative provider.
 *
 * @param subject the lesson or course title the prompt is about
 */
public record Prompt(PromptKind kind, String subject, String text) {}
