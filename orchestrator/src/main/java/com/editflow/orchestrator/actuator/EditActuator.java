package com.editflow.orchestrator.actuator;

/**
 * The host-controlled component that actually edits a subject.
 *
 * The engine only ever calls these three operations; it never edits anything
 * itself. {@link #checkpoint} is called at most once per attempt.
 */
public interface EditActuator {

    /**
     * Take a restorable snapshot of the subject.
     *
     * @return opaque handle to pass to {@link #rollback}
     * @throws ActuatorException if no checkpoint could be taken
     */
    String checkpoint(String subjectRef);

    /** Apply the edit described by {@code config}. Never throws; failures come back in the result. */
    DispatchResult dispatch(String subjectRef, String config);

    /** Restore the subject to the checkpoint. Never throws. */
    RollbackResult rollback(String handle);
}
