package com.editflow.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an edit Job.
 *
 * Transitions:
 *   PENDING     → PROCESSING  (claimed by the scheduler for one worker)
 *   PROCESSING  → COMPLETED   (actuator reported success)
 *   PROCESSING  → PENDING     (transient/resource failure, retries left, after backoff)
 *   PROCESSING  → DEAD_LETTER (fatal failure or retries exhausted)
 *   DEAD_LETTER → PENDING     (explicit resubmission only)
 *
 * FAILED exists in the persisted layout but is never entered by the engine.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    DEAD_LETTER;

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTER;
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING     -> EnumSet.of(PROCESSING);
            case PROCESSING  -> EnumSet.of(COMPLETED, PENDING, DEAD_LETTER);
            case DEAD_LETTER -> EnumSet.of(PENDING);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
