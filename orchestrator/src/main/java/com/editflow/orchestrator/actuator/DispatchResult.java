package com.editflow.orchestrator.actuator;

import com.editflow.orchestrator.model.FailureClass;

/**
 * What the actuator said about one dispatch.
 *
 * {@code classification} is null on success.
 */
public record DispatchResult(boolean ok, String error, FailureClass classification) {

    public static DispatchResult success() {
        return new DispatchResult(true, null, null);
    }

    public static DispatchResult failure(FailureClass classification, String error) {
        return new DispatchResult(false, error, classification);
    }
}
