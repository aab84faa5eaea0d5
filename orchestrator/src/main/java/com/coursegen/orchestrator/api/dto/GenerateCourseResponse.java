package com.coursegen.orchestrator.api.dto;

import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * Response body for POST /courses/generate.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerateCourseResponse(UUID jobId, JobStatus status) {

    public static GenerateCourseResponse from(GenerationJob job) {
        return new GenerateCourseResponse(job.getId(), job.getStatus());
    }
}
