package com.coursegen.orchestrator.api;

import com.coursegen.orchestrator.api.dto.ArtifactResponse;
import com.coursegen.orchestrator.api.dto.GenerateCourseRequest;
import com.coursegen.orchestrator.api.dto.GenerateCourseResponse;
import com.coursegen.orchestrator.api.dto.JobStatusResponse;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.service.JobService;
import com.coursegen.orchestrator.service.JobTransitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * REST API for course generation jobs.
 *
 * POST /courses/generate        : submit a topic, returns immediately with the job id
 * GET  /courses/{id}/status     : poll status and progress
 * POST /courses/{id}/cancel     : stop a pending or running job
 * GET  /courses/{id}/artifacts  : which producer made each artifact, and whether it was degraded
 */
@RestController
@RequestMapping("/courses")
public class CourseController {

    private final JobService jobService;

    public CourseController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/courses/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"topic":"Python data analysis","document_ids":[]}'
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerateCourseResponse> generate(@RequestBody GenerateCourseRequest req) {
        try {
            GenerationJob job = jobService.submit(req.topic(), req.documentIds());
            return ResponseEntity.status(HttpStatus.CREATED).body(GenerateCourseResponse.from(job));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}/status")
    public JobStatusResponse getStatus(@PathVariable UUID id) {
        return JobStatusResponse.from(requireJob(id));
    }

    /**
     * HTTP 200: cancellation requested; the job turns FAILED at its next checkpoint
     * HTTP 404: job ID not found
     * HTTP 409: job already COMPLETED or FAILED
     */
    @PostMapping("/{id}/cancel")
    public JobStatusResponse cancel(@PathVariable UUID id) {
        try {
            return JobStatusResponse.from(jobService.cancel(id));
        } catch (NoSuchElementException e) {
            throw notFound(id);
        } catch (JobTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/{id}/artifacts")
    public List<ArtifactResponse> getArtifacts(@PathVariable UUID id) {
        requireJob(id);
        return jobService.getArtifacts(id).stream()
                .map(ArtifactResponse::from)
                .toList();
    }

    private GenerationJob requireJob(UUID id) {
        return jobService.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }
}
