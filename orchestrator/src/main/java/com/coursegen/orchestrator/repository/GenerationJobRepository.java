package com.coursegen.orchestrator.repository;

import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the generation_jobs table.
 */
public interface GenerationJobRepository extends JpaRepository<GenerationJob, UUID> {

    /** Jobs currently in a given status (used for restart recovery). */
    List<GenerationJob> findByStatus(JobStatus status);
}
