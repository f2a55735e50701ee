package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;

/**
 * Outcome of a submission. {@code job} is the stored record when accepted,
 * and the already-existing record (if any) when rejected as a duplicate.
 */
public record SubmitResult(Kind kind, String reason, Job job) {

    public enum Kind {
        ACCEPTED,
        /** The id is already taken; the stored job was left untouched. */
        DUPLICATE,
        /** The submission failed validation and nothing was stored. */
        INVALID
    }

    public boolean accepted() {
        return kind == Kind.ACCEPTED;
    }

    public static SubmitResult accepted(Job job) {
        return new SubmitResult(Kind.ACCEPTED, "accepted", job);
    }

    public static SubmitResult duplicate(String reason, Job existing) {
        return new SubmitResult(Kind.DUPLICATE, reason, existing);
    }

    public static SubmitResult invalid(String reason) {
        return new SubmitResult(Kind.INVALID, reason, null);
    }
}
