package com.editflow.orchestrator.api.dto;

import com.editflow.orchestrator.service.SubmitResult;

/**
 * Response body for POST /jobs, accepted or not.
 * On a duplicate, {@code job} is the record that already exists.
 */
public record SubmitResponse(
        boolean     accepted,
        String      reason,
        JobResponse job
) {
    public static SubmitResponse from(SubmitResult result) {
        return new SubmitResponse(
                result.accepted(),
                result.reason(),
                result.job() == null ? null : JobResponse.from(result.job()));
    }
}
