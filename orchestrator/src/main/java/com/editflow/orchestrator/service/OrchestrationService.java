package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.resource.GovernorState;
import com.editflow.orchestrator.resource.ResourceGovernor;
import com.editflow.orchestrator.scheduler.WakeSignal;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * The operations the REST layer exposes, in one place.
 *
 * Anything that may make a new job admissible (submission, tier change,
 * resume) also raises the wake signal so idle workers look again right away.
 */
@Service
public class OrchestrationService {

    private final IdempotencyGuard guard;
    private final JobStore         store;
    private final ResourceGovernor governor;
    private final WakeSignal       wakeSignal;

    public OrchestrationService(IdempotencyGuard guard,
                                JobStore store,
                                ResourceGovernor governor,
                                WakeSignal wakeSignal) {
        this.guard      = guard;
        this.store      = store;
        this.governor   = governor;
        this.wakeSignal = wakeSignal;
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    public SubmitResult submit(JobSubmission submission) {
        SubmitResult result = guard.submit(submission);
        if (result.accepted()) {
            wakeSignal.signal();
        }
        return result;
    }

    public CancelResult cancel(String id) {
        return store.cancel(id);
    }

    public Optional<Job> getJob(String id) {
        return store.find(id);
    }

    public List<Job> listJobs(JobStatus status, String subjectRef) {
        return store.list(status, subjectRef);
    }

    public QueueStats stats() {
        return store.stats();
    }

    /** Empty if the job does not exist or is no longer PENDING. */
    public Optional<Job> adjustPriority(String id, int tier) {
        Optional<Job> updated = store.adjustTier(id, tier);
        updated.ifPresent(job -> wakeSignal.signal());
        return updated;
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    public GovernorState pause() {
        governor.pause();
        return governor.state();
    }

    public GovernorState resume() {
        governor.resume();
        return governor.state();
    }

    public GovernorState resourceState() {
        return governor.state();
    }
}
