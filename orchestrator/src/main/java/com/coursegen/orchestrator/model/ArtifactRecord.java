package com.coursegen.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted metadata for one {@link StageArtifact}.
 *
 * Degradation is invisible at job-status granularity; these rows are what the
 * verbose artifact endpoint reads to show which tier produced what.
 *
 * DB table: stage_artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_artifacts")
public class ArtifactRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    // 0 for course-level artifacts.
    @Column(name = "lesson_number", nullable = false)
    private int lessonNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageName stage;

    @Column(name = "provider_used", nullable = false)
    private String providerUsed;

    @Column(nullable = false)
    private int tier;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(nullable = false)
    private boolean degraded;

    // Short, human-readable form of the value (a path, or the first characters of text).
    @Column(name = "value_summary", columnDefinition = "TEXT")
    private String valueSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ArtifactRecord() {}   // required by JPA

    public ArtifactRecord(UUID jobId, StageArtifact<?> artifact, String valueSummary) {
        this.jobId        = jobId;
        this.lessonNumber = artifact.lesson().number();
        this.stage        = artifact.stage();
        this.providerUsed = artifact.providerUsed();
        this.tier         = artifact.tier();
        this.attemptCount = artifact.attemptCount();
        this.degraded     = artifact.degraded();
        this.valueSummary = valueSummary;
        this.createdAt    = artifact.createdAt();
    }

    public UUID      getId()           { return id; }
    public UUID      getJobId()        { return jobId; }
    public int       getLessonNumber() { return lessonNumber; }
    public StageName getStage()        { return stage; }
    public String    getProviderUsed() { return providerUsed; }
    public int       getTier()         { return tier; }
    public int       getAttemptCount() { return attemptCount; }
    public boolean   isDegraded()      { return degraded; }
    public String    getValueSummary() { return valueSummary; }
    public Instant   getCreatedAt()    { return createdAt; }
}
