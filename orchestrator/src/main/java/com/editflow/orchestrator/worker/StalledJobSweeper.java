package com.editflow.orchestrator.worker;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.retry.RetryManager;
import com.editflow.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Periodic counterpart of {@link StartupRecovery} for the running process.
 *
 * A job can be left PROCESSING with nothing driving it when a store call
 * fails in the middle of an attempt, or when a timed release back to PENDING
 * fails. Every sweep looks at PROCESSING jobs and, once they have been quiet
 * for longer than {@code stallAfter}:
 * <ul>
 *   <li>a job waiting for resources that is not parked is parked again;</li>
 *   <li>a job whose backoff ended more than {@code stallAfter} ago gets its
 *       release re-armed;</li>
 *   <li>any other job no attempt in this process is running is rolled back
 *       and counted as a transient failure.</li>
 * </ul>
 */
@Component
public class StalledJobSweeper {

    private static final Logger log = LoggerFactory.getLogger(StalledJobSweeper.class);

    private final JobStore     store;
    private final RetryManager retryManager;
    private final JobExecutor  executor;
    private final Clock        clock;
    private final Duration     stallAfter;

    public StalledJobSweeper(JobStore store,
                             RetryManager retryManager,
                             JobExecutor executor,
                             Clock clock,
                             @Value("${editflow.workers.stall-after-ms:300000}") long stallAfterMs) {
        this.store        = store;
        this.retryManager = retryManager;
        this.executor     = executor;
        this.clock        = clock;
        this.stallAfter   = Duration.ofMillis(stallAfterMs);
    }

    // The initial delay keeps the first sweep clear of StartupRecovery.
    @Scheduled(initialDelayString = "${editflow.workers.stall-sweep-ms:60000}",
               fixedDelayString   = "${editflow.workers.stall-sweep-ms:60000}")
    public void scheduledSweep() {
        sweep();
    }

    /** @return number of jobs put back on a path to completion */
    public int sweep() {
        Instant cutoff = clock.instant().minus(stallAfter);
        int recovered = 0;
        for (Job candidate : store.processing()) {
            if (executor.isRunning(candidate.getId())) continue;
            try {
                // Re-read: the listed copy may be stale by the time we get here.
                Optional<Job> fresh = store.find(candidate.getId());
                if (fresh.isEmpty() || !isStalled(fresh.get(), cutoff)) continue;
                Job job = fresh.get();
                if (job.isAwaitingResources() || job.getRetryAt() != null) {
                    log.warn("Re-arming retry of job {} (retryAt={}, awaitingResources={})",
                            job.getId(), job.getRetryAt(), job.isAwaitingResources());
                    retryManager.rearm(job);
                } else {
                    log.warn("Recovering stalled job {} (worker={}, last update={})",
                            job.getId(), job.getWorkerId(), job.getUpdatedAt());
                    executor.recoverInterrupted(job);
                }
                recovered++;
            } catch (RuntimeException e) {
                log.error("Could not recover stalled job {}: {}", candidate.getId(), e.getMessage(), e);
            }
        }
        return recovered;
    }

    private boolean isStalled(Job job, Instant cutoff) {
        if (job.getStatus() != JobStatus.PROCESSING || executor.isRunning(job.getId())) {
            return false;
        }
        if (job.isAwaitingResources()) {
            return !retryManager.isParked(job.getId()) && job.getUpdatedAt().isBefore(cutoff);
        }
        if (job.getRetryAt() != null) {
            return job.getRetryAt().isBefore(cutoff);
        }
        return job.getUpdatedAt().isBefore(cutoff);
    }
}
