package com.coursegen.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * What one stage produced for one lesson (or for the course, see {@link LessonId#COURSE}).
 *
 * Never edited after creation; a re-attempt replaces the whole artifact.
 *
 * @param value         stage-dependent payload (lesson JSON, script text, file path ...)
 * @param providerUsed  name of the producer that succeeded
 * @param tier          1-based position of that producer in its fallback chain
 * @param attemptCount  producer invocations made, across all tiers
 * @param degraded      true if any earlier tier failed before the successful one
 * @param failures      one line per failed attempt, in order
 */
public record StageArtifact<T>(
        LessonId     lesson,
        StageName    stage,
        T            value,
        String       providerUsed,
        int          tier,
        int          attemptCount,
        boolean      degraded,
        List<String> failures,
        Instant      createdAt
) {
    public StageArtifact {
        failures = failures == null ? List.of() : List.copyOf(failures);
        if (createdAt == null) createdAt = Instant.now();
    }
}
