package com.editflow.orchestrator.service;

/**
 * Everything an upstream collaborator supplies when asking for an edit.
 *
 * {@code requiredMemoryMb} and {@code allowResubmission} are optional and
 * default to 0 / false.
 */
public record JobSubmission(
        String  id,
        String  subjectRef,
        int     priorityTier,
        double  qualityScore,
        String  config,
        long    requiredMemoryMb,
        boolean allowResubmission
) {
    public JobSubmission(String id, String subjectRef, int priorityTier,
                         double qualityScore, String config) {
        this(id, subjectRef, priorityTier, qualityScore, config, 0, false);
    }
}
