package com.coursegen.orchestrator.repository;

import com.coursegen.orchestrator.model.ArtifactRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Stage artifact metadata, written by the orchestrator after each stage.
 */
public interface ArtifactRecordRepository extends JpaRepository<ArtifactRecord, UUID> {

    /** All artifacts of a job, in the order they were produced. */
    List<ArtifactRecord> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
