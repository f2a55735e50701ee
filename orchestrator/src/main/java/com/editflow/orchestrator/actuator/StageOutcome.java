package com.editflow.orchestrator.actuator;

/**
 * Result of one bounded actuator call: a value, a timeout, or an error.
 */
public record StageOutcome<T>(T value, boolean timedOut, RuntimeException error) {

    public static <T> StageOutcome<T> of(T value) {
        return new StageOutcome<>(value, false, null);
    }

    public static <T> StageOutcome<T> timeout() {
        return new StageOutcome<>(null, true, null);
    }

    public static <T> StageOutcome<T> failed(RuntimeException error) {
        return new StageOutcome<>(null, false, error);
    }

    public boolean completed() {
        return !timedOut && error == null;
    }

    /** One-line description of what went wrong, or null if the call completed. */
    public String describeFailure(String stage, long timeoutMs) {
        if (timedOut) return stage + " timed out after " + timeoutMs + " ms";
        if (error != null) return stage + " failed: " + error.getMessage();
        return null;
    }
}
