package com.editflow.orchestrator.retry;

import com.editflow.orchestrator.model.FailureClass;
import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.resource.GovernorState;
import com.editflow.orchestrator.resource.ResourceGovernor;
import com.editflow.orchestrator.scheduler.WakeSignal;
import com.editflow.orchestrator.service.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Turns a failed attempt into a decision and carries it out.
 *
 * <ul>
 *   <li>FATAL: dead-letter immediately, whatever the retry count.</li>
 *   <li>TRANSIENT with retries left: book the retry, then a timer moves the
 *       job back to PENDING after the backoff. No worker waits for it.</li>
 *   <li>RESOURCE with retries left: book the retry and park the job until a
 *       governor sample says it can be admitted again.</li>
 *   <li>Retries exhausted: dead-letter.</li>
 * </ul>
 * The caller must already have rolled the subject back.
 */
@Component
public class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    private final JobStore                 store;
    private final ResourceGovernor         governor;
    private final WakeSignal               wakeSignal;
    private final Clock                    clock;
    private final MeterRegistry            meterRegistry;
    private final BackoffPolicy            backoff;
    private final int                      maxRetries;
    private final ScheduledExecutorService timer;

    // Jobs waiting for resources, keyed by id, valued by declared memory need.
    private final Map<String, Long> parked = new ConcurrentHashMap<>();

    @Autowired
    public RetryManager(JobStore store,
                        ResourceGovernor governor,
                        WakeSignal wakeSignal,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        @Value("${editflow.retry.max-retries:3}") int maxRetries,
                        @Value("${editflow.retry.base-delay-ms:1000}") long baseDelayMs,
                        @Value("${editflow.retry.max-delay-ms:60000}") long maxDelayMs,
                        @Value("${editflow.retry.jitter-ratio:0.1}") double jitterRatio) {
        this(store, governor, wakeSignal, clock, meterRegistry, maxRetries,
                new BackoffPolicy(Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitterRatio),
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "retry-timer");
                    t.setDaemon(true);
                    return t;
                }));
    }

    public RetryManager(JobStore store,
                        ResourceGovernor governor,
                        WakeSignal wakeSignal,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        int maxRetries,
                        BackoffPolicy backoff,
                        ScheduledExecutorService timer) {
        this.store         = store;
        this.governor      = governor;
        this.wakeSignal    = wakeSignal;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.maxRetries    = maxRetries;
        this.backoff       = backoff;
        this.timer         = timer;
        governor.addListener(this::onGovernorSample);
    }

    // ------------------------------------------------------------------
    // Decision
    // ------------------------------------------------------------------

    /** Pure classification; no side effects. */
    public RetryDecision decide(Job job, AttemptFailure failure) {
        FailureClass cls = failure.classification();
        if (cls == FailureClass.FATAL) {
            return RetryDecision.deadLetter("fatal: " + failure.message());
        }
        if (job.getRetryCount() >= maxRetries) {
            return RetryDecision.deadLetter("retries exhausted (" + job.getRetryCount() + "/" + maxRetries
                    + "), last error: " + failure.message());
        }
        if (cls == FailureClass.RESOURCE) {
            return RetryDecision.retryWhenResourcesFree("waiting for resources: " + failure.message());
        }
        Duration delay = backoff.delayFor(job.getRetryCount());
        return RetryDecision.retryAfter(delay, "retry in " + delay.toMillis() + " ms: " + failure.message());
    }

    /**
     * Decide and apply: dead-letter the job, or book the retry and arrange
     * its return to PENDING.
     */
    public RetryDecision handleFailure(Job job, AttemptFailure failure) {
        RetryDecision decision = decide(job, failure);
        String line = "[attempt " + (job.getRetryCount() + 1) + "] "
                + failure.classification() + ": " + failure.message();

        meterRegistry.counter("editflow.jobs.failures",
                "class", failure.classification().name().toLowerCase(),
                "decision", decision.outcome().name().toLowerCase()).increment();

        if (!decision.isRetry()) {
            store.deadLetter(job.getId(), line);
            return decision;
        }

        Instant retryAt = decision.waitForResources() ? null : clock.instant().plus(decision.delay());
        if (store.recordRetry(job.getId(), line, retryAt, decision.waitForResources()).isEmpty()) {
            log.warn("Job {} was not PROCESSING when booking its retry; leaving it alone", job.getId());
            return decision;
        }
        if (decision.waitForResources()) {
            park(job.getId(), job.getRequiredMemoryMb());
        } else {
            scheduleRelease(job.getId(), decision.delay());
        }
        return decision;
    }

    /**
     * Re-arm the return path of a job that was already waiting for a retry
     * when the process stopped.
     */
    public void rearm(Job job) {
        if (job.getStatus() != JobStatus.PROCESSING) return;
        if (job.isAwaitingResources()) {
            park(job.getId(), job.getRequiredMemoryMb());
        } else if (job.getRetryAt() != null) {
            Duration remaining = Duration.between(clock.instant(), job.getRetryAt());
            scheduleRelease(job.getId(), remaining.isNegative() ? Duration.ZERO : remaining);
        }
    }

    public boolean isParked(String jobId) {
        return parked.containsKey(jobId);
    }

    /** Number of jobs currently parked until resources free up. */
    public int parkedCount() {
        return parked.size();
    }

    // ------------------------------------------------------------------
    // Re-entry
    // ------------------------------------------------------------------

    private void scheduleRelease(String jobId, Duration delay) {
        log.debug("Job {} returns to PENDING in {} ms", jobId, delay.toMillis());
        timer.schedule(() -> release(jobId), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void park(String jobId, long requiredMemoryMb) {
        parked.put(jobId, requiredMemoryMb);
        log.info("Job {} parked until resources free up (needs {} MB)", jobId, requiredMemoryMb);
    }

    void onGovernorSample(GovernorState state) {
        if (parked.isEmpty() || !state.canAdmit()) return;
        parked.forEach((jobId, requiredMb) -> {
            if (governor.hasMemoryFor(requiredMb) && parked.remove(jobId, requiredMb)) {
                release(jobId);
            }
        });
    }

    private void release(String jobId) {
        try {
            store.releaseToPending(jobId).ifPresent(job -> wakeSignal.signal());
        } catch (RuntimeException e) {
            // The job keeps its retryAt / awaitingResources; StalledJobSweeper re-arms it.
            log.error("Could not return job {} to PENDING: {}", jobId, e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        timer.shutdownNow();
    }
}
