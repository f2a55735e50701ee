package com.editflow.orchestrator.model;

/**
 * How a failed attempt is treated by the retry logic.
 */
public enum FailureClass {
    TRANSIENT,  // network, timeout, actuator busy: exponential backoff
    RESOURCE,   // accelerator OOM and the like: wait until resources free up
    FATAL       // malformed payload or explicit non-retryable rejection
}
