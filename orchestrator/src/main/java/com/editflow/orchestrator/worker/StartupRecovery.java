package com.editflow.orchestrator.worker;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.retry.RetryManager;
import com.editflow.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Puts PROCESSING jobs left over from a previous run back on a path to
 * completion, before any worker starts.
 *
 * Two kinds of leftovers:
 * <ul>
 *   <li>Jobs that were waiting out a backoff or for resources: their timer or
 *       park entry lived in memory, so it is re-armed.</li>
 *   <li>Jobs a worker owned mid-attempt: the outcome is unknown, so the
 *       subject is rolled back and the attempt counts as a transient failure.</li>
 * </ul>
 */
@Component
public class StartupRecovery {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    private final JobStore     store;
    private final RetryManager retryManager;
    private final JobExecutor  executor;

    public StartupRecovery(JobStore store, RetryManager retryManager, JobExecutor executor) {
        this.store        = store;
        this.retryManager = retryManager;
        this.executor     = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void onApplicationReady() {
        recover();
    }

    /** @return number of jobs recovered */
    public int recover() {
        List<Job> leftovers = store.processing();
        if (leftovers.isEmpty()) {
            return 0;
        }
        log.warn("Recovering {} job(s) left PROCESSING by a previous run", leftovers.size());
        int recovered = 0;
        for (Job job : leftovers) {
            try {
                if (job.getRetryAt() != null || job.isAwaitingResources()) {
                    retryManager.rearm(job);
                } else {
                    executor.recoverInterrupted(job);
                }
                recovered++;
            } catch (RuntimeException e) {
                log.error("Could not recover job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        return recovered;
    }
}
