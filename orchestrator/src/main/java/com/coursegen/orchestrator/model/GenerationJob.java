package com.coursegen.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One end-to-end course generation request.
 *
 * Owned by the orchestrator execution that drives it; every mutation goes
 * through {@link com.coursegen.orchestrator.service.JobStateMachine} so the
 * status/progress invariants hold. External callers only read it.
 *
 * DB table: generation_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "generation_jobs")
public class GenerationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String topic;

    // Source document references, in submission order.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "generation_job_documents", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "document_id", nullable = false)
    private List<UUID> documentIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int progress = 0;

    // Path of the course archive; set only on COMPLETED.
    @Column(name = "result_reference")
    private String resultReference;

    // Set only on FAILED.
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // All three timestamps come from the application Clock, never the wall clock.
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected GenerationJob() {}   // required by JPA

    public GenerationJob(String topic, List<UUID> documentIds, Instant createdAt) {
        this.topic     = topic;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        if (documentIds != null) {
            this.documentIds.addAll(documentIds);
        }
    }

    public UUID       getId()              { return id; }
    public String     getTopic()           { return topic; }
    public List<UUID> getDocumentIds()     { return documentIds; }
    public JobStatus  getStatus()          { return status; }
    public int        getProgress()        { return progress; }
    public String     getResultReference() { return resultReference; }
    public String     getErrorMessage()    { return errorMessage; }
    public Instant    getCreatedAt()       { return createdAt; }
    public Instant    getUpdatedAt()       { return updatedAt; }
    public Instant    getCompletedAt()     { return completedAt; }

    public void setStatus(JobStatus status)            { this.status = status; }
    public void setProgress(int progress)              { this.progress = progress; }
    public void setResultReference(String reference)   { this.resultReference = reference; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setCompletedAt(Instant completedAt)    { this.completedAt = completedAt; }
    public void setUpdatedAt(Instant updatedAt)        { this.updatedAt = updatedAt; }
}
