package com.editflow.orchestrator.worker;

import com.editflow.orchestrator.actuator.ActuatorStageRunner;
import com.editflow.orchestrator.actuator.DispatchResult;
import com.editflow.orchestrator.actuator.EditActuator;
import com.editflow.orchestrator.actuator.RollbackResult;
import com.editflow.orchestrator.actuator.StageOutcome;
import com.editflow.orchestrator.failsafe.CheckpointResult;
import com.editflow.orchestrator.failsafe.FailsafeManager;
import com.editflow.orchestrator.model.FailureClass;
import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.retry.AttemptFailure;
import com.editflow.orchestrator.retry.RetryManager;
import com.editflow.orchestrator.service.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one attempt of a claimed job:
 * <pre>
 *   checkpoint → dispatch (bounded by the stage timeout)
 *     ok     → COMPLETED
 *     failed → rollback → RetryManager (back to PENDING later, or DEAD_LETTER)
 * </pre>
 * The job arrives already PROCESSING and owned by the calling worker; it
 * stays owned by that worker until this method returns.
 */
@Component
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final EditActuator        actuator;
    private final ActuatorStageRunner stages;
    private final FailsafeManager     failsafe;
    private final RetryManager        retryManager;
    private final JobStore            store;
    private final MeterRegistry       meterRegistry;

    // Ids of jobs with an attempt running in this process right now.
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobExecutor(EditActuator actuator,
                       ActuatorStageRunner stages,
                       FailsafeManager failsafe,
                       RetryManager retryManager,
                       JobStore store,
                       MeterRegistry meterRegistry) {
        this.actuator      = actuator;
        this.stages        = stages;
        this.failsafe      = failsafe;
        this.retryManager  = retryManager;
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point, called by WorkerPool for each claimed job
    // ------------------------------------------------------------------

    public void run(Job job, String workerId) {
        inFlight.add(job.getId());
        // Every log line from this attempt carries these fields.
        MDC.put("jobId",      job.getId());
        MDC.put("subjectRef", job.getSubjectRef());
        MDC.put("attempt",    String.valueOf(job.getRetryCount() + 1));
        MDC.put("workerId",   workerId);
        try {
            log.info("Starting attempt {} of job {} (tier={}, subject={})",
                    job.getRetryCount() + 1, job.getId(), job.getPriorityTier(), job.getSubjectRef());

            CheckpointResult checkpoint = failsafe.checkpoint(job);
            if (!checkpoint.ok()) {
                // Nothing was dispatched, so there is nothing to roll back either.
                handleFailure(job, AttemptFailure.transientFailure(checkpoint.error()));
                return;
            }

            StageOutcome<DispatchResult> outcome =
                    stages.run("dispatch", () -> actuator.dispatch(job.getSubjectRef(), job.getConfig()));
            DispatchResult result = outcome.completed()
                    ? outcome.value()
                    : DispatchResult.failure(FailureClass.TRANSIENT,
                            outcome.describeFailure("dispatch", stages.stageTimeout().toMillis()));

            if (result.ok()) {
                store.complete(job.getId());
                meterRegistry.counter("editflow.jobs.outcomes", "outcome", "completed").increment();
                return;
            }

            FailureClass cls = result.classification() == null ? FailureClass.TRANSIENT : result.classification();
            handleFailure(job, new AttemptFailure(cls, result.error()));
        } catch (RuntimeException e) {
            // Store or bookkeeping error. The job is left PROCESSING and
            // StalledJobSweeper routes it through the retry path later.
            log.error("Unhandled error while running job {}: {}", job.getId(), e.getMessage(), e);
        } finally {
            inFlight.remove(job.getId());
            // Worker threads are pooled; don't leak this job's context into the next one.
            MDC.clear();
        }
    }

    /** True while an attempt of this job is running in this process. */
    public boolean isRunning(String jobId) {
        return inFlight.contains(jobId);
    }

    /**
     * Finish an attempt whose outcome is unknown because the process stopped
     * mid-flight: roll back, then treat it as a transient failure.
     */
    public void recoverInterrupted(Job job) {
        MDC.put("jobId", job.getId());
        try {
            log.warn("Job {} was PROCESSING when the engine stopped; outcome unknown", job.getId());
            handleFailure(job, AttemptFailure.transientFailure("outcome unknown: engine stopped during attempt"));
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Roll the subject back exactly once, then let RetryManager decide.
     * If the rollback itself fails the subject's state is unknown, so the job
     * is dead-lettered for an operator instead of being retried on top of it.
     */
    private void handleFailure(Job job, AttemptFailure failure) {
        RollbackResult rollback = failsafe.rollback(job);
        if (!rollback.ok()) {
            store.deadLetter(job.getId(), "[attempt " + (job.getRetryCount() + 1) + "] "
                    + failure.classification() + ": " + failure.message()
                    + "; rollback failed: " + rollback.error());
            meterRegistry.counter("editflow.jobs.outcomes", "outcome", "rollback_failed").increment();
            return;
        }
        var decision = retryManager.handleFailure(job, failure);
        meterRegistry.counter("editflow.jobs.outcomes", "outcome",
                decision.isRetry() ? "retried" : "dead_letter").increment();
        log.info("Job {} attempt failed ({}): {}", job.getId(), failure.classification(), decision.reason());
    }
}
