package com.editflow.orchestrator.retry;

import java.time.Duration;

/**
 * What happens to a job after a failed attempt.
 *
 * @param outcome           RETRY or DEAD_LETTER
 * @param delay             backoff before re-entering PENDING; null when waiting for resources or dead-lettering
 * @param waitForResources  re-enter PENDING once the governor can admit the job again
 * @param reason            human-readable explanation, also logged
 */
public record RetryDecision(Outcome outcome, Duration delay, boolean waitForResources, String reason) {

    public enum Outcome { RETRY, DEAD_LETTER }

    public static RetryDecision retryAfter(Duration delay, String reason) {
        return new RetryDecision(Outcome.RETRY, delay, false, reason);
    }

    public static RetryDecision retryWhenResourcesFree(String reason) {
        return new RetryDecision(Outcome.RETRY, null, true, reason);
    }

    public static RetryDecision deadLetter(String reason) {
        return new RetryDecision(Outcome.DEAD_LETTER, null, false, reason);
    }

    public boolean isRetry() {
        return outcome == Outcome.RETRY;
    }
}
