package com.editflow.orchestrator.resource;

/**
 * Immutable view of what the governor last decided.
 *
 * @param snapshot          latest sample, null before the first one
 * @param cpuThrottled      CPU went over the ceiling and has not yet dropped below the low watermark
 * @param thermalPaused     accelerator went over the hard limit and has not yet cooled below the resume threshold
 * @param operatorPaused    admission paused by an operator
 * @param concurrencyLimit  how many jobs may run at once right now
 */
public record GovernorState(
        ResourceSnapshot snapshot,
        boolean          cpuThrottled,
        boolean          thermalPaused,
        boolean          operatorPaused,
        int              concurrencyLimit
) {
    public boolean canAdmit() {
        return !thermalPaused && !operatorPaused;
    }
}
