package com.editflow.orchestrator.api.dto;

import com.editflow.orchestrator.service.JobSubmission;

/**
 * Request body for POST /jobs.
 *
 * Required: id, subjectRef, priorityTier (1 = highest)
 * Optional: qualityScore (default 0), config (opaque, forwarded to the
 * actuator as-is), requiredMemoryMb (default 0 = no accelerator memory gate),
 * allowResubmission (default false; only honoured for DEAD_LETTER jobs)
 */
public record SubmitJobRequest(
        String  id,
        String  subjectRef,
        Integer priorityTier,
        Double  qualityScore,
        String  config,
        Long    requiredMemoryMb,
        Boolean allowResubmission
) {
    public JobSubmission toSubmission() {
        return new JobSubmission(
                id,
                subjectRef,
                priorityTier == null ? 0 : priorityTier,
                qualityScore == null ? 0.0 : qualityScore,
                config,
                requiredMemoryMb == null ? 0L : requiredMemoryMb,
                Boolean.TRUE.equals(allowResubmission)
        );
    }
}
