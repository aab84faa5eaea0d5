package com.coursegen.orchestrator.fallback;

import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;

import java.util.List;

/**
 * Value delivered by a {@link FallbackChain}, with which tier delivered it.
 */
public record ChainResult<O>(
        O                 value,
        String            producer,
        int               tier,
        int               attemptCount,
        boolean           degraded,
        List<TierFailure> failures
) {
    public ChainResult {
        failures = List.copyOf(failures);
    }

    public StageArtifact<O> toArtifact(LessonId lesson, StageName stage) {
        return toArtifact(lesson, stage, value);
    }

    /** Same tier metadata, carrying a derived value (e.g. a parsed object). */
    public <T> StageArtifact<T> toArtifact(LessonId lesson, StageName stage, T derivedValue) {
        return new StageArtifact<>(lesson, stage, derivedValue, producer, tier, attemptCount, degraded,
                failures.stream().map(TierFailure::summary).toList(), null);
    }
}
