package com.editflow.orchestrator.api.dto;

import com.editflow.orchestrator.model.Job;

import java.time.Instant;

/**
 * Response body for GET /jobs/{id} and the job listings.
 * {@code errorMessage} holds one line per failed attempt.
 */
public record JobResponse(
        String  id,
        String  subjectRef,
        String  status,
        int     priorityTier,
        double  qualityScore,
        double  dynamicScore,
        int     retryCount,
        long    requiredMemoryMb,
        String  workerId,
        Instant retryAt,
        boolean awaitingResources,
        String  errorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getSubjectRef(),
                job.getStatus().name(),
                job.getPriorityTier(),
                job.getQualityScore(),
                job.getDynamicScore(),
                job.getRetryCount(),
                job.getRequiredMemoryMb(),
                job.getWorkerId(),
                job.getRetryAt(),
                job.isAwaitingResources(),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getUpdatedAt()
        );
    }
}
