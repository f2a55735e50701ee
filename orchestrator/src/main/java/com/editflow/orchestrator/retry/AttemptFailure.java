package com.editflow.orchestrator.retry;

import com.editflow.orchestrator.model.FailureClass;

/**
 * Why one attempt at a job failed.
 */
public record AttemptFailure(FailureClass classification, String message) {

    public static AttemptFailure transientFailure(String message) {
        return new AttemptFailure(FailureClass.TRANSIENT, message);
    }

    public static AttemptFailure resource(String message) {
        return new AttemptFailure(FailureClass.RESOURCE, message);
    }

    public static AttemptFailure fatal(String message) {
        return new AttemptFailure(FailureClass.FATAL, message);
    }
}
