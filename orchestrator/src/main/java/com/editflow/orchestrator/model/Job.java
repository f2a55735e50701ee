package com.editflow.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One edit request for a single subject (e.g. a photo).
 *
 * The id is supplied by the caller and doubles as the idempotency key, so
 * the entity implements {@link Persistable} to make Spring Data issue a plain
 * INSERT for new rows instead of a merge that could overwrite an existing one.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job implements Persistable<String> {

    @Id
    private String id;

    @Column(name = "subject_ref", nullable = false)
    private String subjectRef;

    @Column(name = "priority_tier", nullable = false)
    private int priorityTier;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    // Last score computed by the scheduler. Informational only; never used
    // as an input to the next selection pass.
    @Column(name = "dynamic_score", nullable = false)
    private double dynamicScore;

    // Opaque payload, handed to the actuator byte-for-byte.
    @Column(columnDefinition = "TEXT")
    private String config;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "checkpoint_handle")
    private String checkpointHandle;

    // Submission order. Breaks score ties after createdAt.
    @Column(nullable = false)
    private long sequence;

    // Accelerator memory the job declares it needs; 0 = no requirement.
    @Column(name = "required_memory_mb", nullable = false)
    private long requiredMemoryMb = 0;

    @Column(name = "worker_id")
    private String workerId;

    // Set while a PROCESSING job waits out its backoff delay.
    @Column(name = "retry_at")
    private Instant retryAt;

    // Set while a PROCESSING job waits for the governor to admit it again.
    @Column(name = "awaiting_resources", nullable = false)
    private boolean awaitingResources = false;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean isNew = false;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String id, String subjectRef, int priorityTier, double qualityScore,
               String config, long requiredMemoryMb, Instant createdAt) {
        this.id               = id;
        this.subjectRef       = subjectRef;
        this.priorityTier     = priorityTier;
        this.qualityScore     = qualityScore;
        this.config           = config;
        this.requiredMemoryMb = requiredMemoryMb;
        this.createdAt        = createdAt;
        this.updatedAt        = createdAt;
        this.isNew            = true;
    }

    /**
     * Wipe an existing DEAD_LETTER record back to a fresh submission.
     * Only the resubmission path of the idempotency guard calls this.
     */
    public void resetForResubmission(String subjectRef, int priorityTier, double qualityScore,
                                     String config, long requiredMemoryMb, Instant now) {
        this.subjectRef        = subjectRef;
        this.priorityTier      = priorityTier;
        this.qualityScore      = qualityScore;
        this.config            = config;
        this.requiredMemoryMb  = requiredMemoryMb;
        this.status            = JobStatus.PENDING;
        this.retryCount        = 0;
        this.dynamicScore      = 0;
        this.checkpointHandle  = null;
        this.workerId          = null;
        this.retryAt           = null;
        this.awaitingResources = false;
        this.errorMessage      = null;
        this.createdAt         = now;
        this.startedAt         = null;
        this.completedAt       = null;
    }

    // ------------------------------------------------------------------
    // Persistable
    // ------------------------------------------------------------------

    @Override
    public String getId() { return id; }

    @Override
    public boolean isNew() { return isNew; }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String    getSubjectRef()        { return subjectRef; }
    public int       getPriorityTier()      { return priorityTier; }
    public double    getQualityScore()      { return qualityScore; }
    public double    getDynamicScore()      { return dynamicScore; }
    public String    getConfig()            { return config; }
    public JobStatus getStatus()            { return status; }
    public int       getRetryCount()        { return retryCount; }
    public String    getCheckpointHandle()  { return checkpointHandle; }
    public long      getSequence()          { return sequence; }
    public long      getRequiredMemoryMb()  { return requiredMemoryMb; }
    public String    getWorkerId()          { return workerId; }
    public Instant   getRetryAt()           { return retryAt; }
    public boolean   isAwaitingResources()  { return awaitingResources; }
    public String    getErrorMessage()      { return errorMessage; }
    public Instant   getCreatedAt()         { return createdAt; }
    public Instant   getStartedAt()         { return startedAt; }
    public Instant   getCompletedAt()       { return completedAt; }
    public Instant   getUpdatedAt()         { return updatedAt; }

    public void setStatus(JobStatus status)                 { this.status = status; }
    public void setPriorityTier(int priorityTier)           { this.priorityTier = priorityTier; }
    public void setDynamicScore(double dynamicScore)        { this.dynamicScore = dynamicScore; }
    public void setCheckpointHandle(String handle)          { this.checkpointHandle = handle; }
    public void setSequence(long sequence)                  { this.sequence = sequence; }
    public void setWorkerId(String workerId)                { this.workerId = workerId; }
    public void setRetryAt(Instant retryAt)                 { this.retryAt = retryAt; }
    public void setAwaitingResources(boolean v)             { this.awaitingResources = v; }
    public void setStartedAt(Instant t)                     { this.startedAt = t; }
    public void setCompletedAt(Instant t)                   { this.completedAt = t; }
    public void incrementRetryCount()                       { this.retryCount++; }

    /** Append one line to the failure history kept in errorMessage. */
    public void appendError(String line) {
        this.errorMessage = (errorMessage == null || errorMessage.isEmpty())
                ? line
                : errorMessage + "\n" + line;
    }
}
