package com.editflow.orchestrator.actuator;

/**
 * Thrown when the host bridge returns an error or is unreachable.
 *
 * Only {@link EditActuator#checkpoint} lets it escape; the engine turns it
 * into a transient failure of the attempt.
 */
public class ActuatorException extends RuntimeException {

    private final int httpStatus;

    public ActuatorException(String message) {
        this(message, -1);
    }

    public ActuatorException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public ActuatorException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /** HTTP status returned by the bridge, or -1 for transport errors. */
    public int getHttpStatus() { return httpStatus; }
}
