package com.editflow.orchestrator.service;

/**
 * Outcome of a cancellation request. Only PENDING jobs can be cancelled.
 */
public record CancelResult(boolean ok, String reason) {

    public static CancelResult cancelled() {
        return new CancelResult(true, "cancelled");
    }

    public static CancelResult refused(String reason) {
        return new CancelResult(false, reason);
    }
}
