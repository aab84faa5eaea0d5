package com.coursegen.orchestrator.api.dto;

import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.StageName;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One produced artifact, as listed by GET /courses/{id}/artifacts.
 * lesson_number is 0 for course-level artifacts.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArtifactResponse(
        int       lessonNumber,
        StageName stage,
        String    providerUsed,
        int       tier,
        int       attemptCount,
        boolean   degraded,
        String    valueSummary,
        Instant   createdAt
) {
    public static ArtifactResponse from(ArtifactRecord r) {
        return new ArtifactResponse(
                r.getLessonNumber(),
                r.getStage(),
                r.getProviderUsed(),
                r.getTier(),
                r.getAttemptCount(),
                r.isDegraded(),
                r.getValueSummary(),
                r.getCreatedAt()
        );
    }
}
