package com.editflow.orchestrator.failsafe;

/**
 * Outcome of asking the actuator for a checkpoint. {@code handle} is null on failure.
 */
public record CheckpointResult(String handle, String error) {

    public boolean ok() {
        return handle != null;
    }
}
