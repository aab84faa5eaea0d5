package com.coursegen.orchestrator.provider;

/**
 * What a text prompt asks for. Live providers ignore it; mock providers use
 * it to pick a canned answer.
 */
public enum PromptKind {
    CURRICULUM,
    LESSON_CONTENT,
    COURSE_DESCRIPTION,
    SPEECH_SCRIPT,
    IMAGE
}
