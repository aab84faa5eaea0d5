package com.coursegen.orchestrator.api.dto;

import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /courses/{id}/status and POST /courses/{id}/cancel.
 * result_url (the course archive) is present only once COMPLETED, error_message only once FAILED.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        UUID      jobId,
        String    topic,
        JobStatus status,
        int       progress,
        String    resultUrl,
        String    errorMessage,
        Instant   createdAt,
        Instant   updatedAt,
        Instant   completedAt
) {
    public static JobStatusResponse from(GenerationJob job) {
        return new JobStatusResponse(
                job.getId(),
                job.getTopic(),
                job.getStatus(),
                job.getProgress(),
                job.getResultReference(),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt()
        );
    }
}
