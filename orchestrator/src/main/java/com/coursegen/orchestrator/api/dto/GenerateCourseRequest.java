package com.coursegen.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /courses/generate.
 *
 * Required: topic
 * Optional: document_ids (source documents, in the order they should be used)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerateCourseRequest(String topic, List<UUID> documentIds) {

    public GenerateCourseRequest {
        if (documentIds == null) documentIds = List.of();
    }
}
