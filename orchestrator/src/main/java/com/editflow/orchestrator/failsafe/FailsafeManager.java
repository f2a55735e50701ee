package com.editflow.orchestrator.failsafe;

import com.editflow.orchestrator.actuator.ActuatorStageRunner;
import com.editflow.orchestrator.actuator.EditActuator;
import com.editflow.orchestrator.actuator.RollbackResult;
import com.editflow.orchestrator.actuator.StageOutcome;
import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the subject restorable around each attempt.
 *
 * Before dispatch the actuator takes a checkpoint and its handle goes onto
 * the job record. After a failed dispatch the subject is rolled back to that
 * handle, and the handle is cleared, before the job moves on. Because the
 * handle is read from the store and cleared on success, a second rollback
 * for the same attempt finds nothing to do.
 */
@Component
public class FailsafeManager {

    private static final Logger log = LoggerFactory.getLogger(FailsafeManager.class);

    private final EditActuator        actuator;
    private final ActuatorStageRunner stages;
    private final JobStore            store;

    public FailsafeManager(EditActuator actuator, ActuatorStageRunner stages, JobStore store) {
        this.actuator = actuator;
        this.stages   = stages;
        this.store    = store;
    }

    public CheckpointResult checkpoint(Job job) {
        StageOutcome<String> outcome = stages.run("checkpoint", () -> actuator.checkpoint(job.getSubjectRef()));
        if (!outcome.completed()) {
            String error = outcome.describeFailure("checkpoint", stages.stageTimeout().toMillis());
            log.warn("Job {}: {}", job.getId(), error);
            return new CheckpointResult(null, error);
        }
        String handle = outcome.value();
        store.saveCheckpoint(job.getId(), handle);
        job.setCheckpointHandle(handle);
        log.info("Job {}: checkpoint '{}' taken for subject '{}'", job.getId(), handle, job.getSubjectRef());
        return new CheckpointResult(handle, null);
    }

    /**
     * Restore the subject to the checkpoint stored on the job.
     * A job without a stored handle has nothing to restore and counts as success.
     */
    public RollbackResult rollback(Job job) {
        String handle = store.find(job.getId())
                .map(Job::getCheckpointHandle)
                .orElse(null);
        if (handle == null) {
            log.debug("Job {}: no checkpoint to roll back", job.getId());
            return RollbackResult.success();
        }

        StageOutcome<RollbackResult> outcome = stages.run("rollback", () -> actuator.rollback(handle));
        RollbackResult result = outcome.completed()
                ? outcome.value()
                : RollbackResult.failure(outcome.describeFailure("rollback", stages.stageTimeout().toMillis()));

        if (result.ok()) {
            store.clearCheckpoint(job.getId());
            job.setCheckpointHandle(null);
            log.info("Job {}: subject '{}' rolled back to '{}'", job.getId(), job.getSubjectRef(), handle);
        } else {
            log.error("Job {}: rollback to '{}' failed: {}", job.getId(), handle, result.error());
        }
        return result;
    }
}
