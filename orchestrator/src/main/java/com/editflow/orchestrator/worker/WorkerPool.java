package com.editflow.orchestrator.worker;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.resource.ResourceGovernor;
import com.editflow.orchestrator.scheduler.PriorityScheduler;
import com.editflow.orchestrator.scheduler.WakeSignal;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker threads that pull jobs and run them.
 *
 * There are {@code maxWorkers} threads, but at most
 * {@code min(maxWorkers, governor.concurrencyLimit())} of them run a job at a
 * time; the rest idle on the {@link WakeSignal}. A worker with a free slot
 * asks the scheduler for the best admissible job; if there is none it waits
 * for a wake-up (submission, retry re-entry, governor change) or the idle
 * timeout, whichever comes first.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final PriorityScheduler scheduler;
    private final ResourceGovernor  governor;
    private final JobExecutor       executor;
    private final WakeSignal        wakeSignal;
    private final int               maxWorkers;
    private final Duration          idleWait;
    private final boolean           enabled;

    private final AtomicInteger active = new AtomicInteger();
    private final Object        slotLock = new Object();

    private volatile boolean running = false;
    private ExecutorService  workers;

    public WorkerPool(PriorityScheduler scheduler,
                      ResourceGovernor governor,
                      JobExecutor executor,
                      WakeSignal wakeSignal,
                      @Value("${editflow.workers.max:4}") int maxWorkers,
                      @Value("${editflow.workers.idle-wait-ms:1000}") long idleWaitMs,
                      @Value("${editflow.workers.enabled:true}") boolean enabled) {
        this.scheduler  = scheduler;
        this.governor   = governor;
        this.executor   = executor;
        this.wakeSignal = wakeSignal;
        this.maxWorkers = maxWorkers;
        this.idleWait   = Duration.ofMillis(idleWaitMs);
        this.enabled    = enabled;
    }

    // Runs after StartupRecovery so interrupted jobs are dealt with first.
    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        if (enabled) {
            start();
        } else {
            log.info("Worker pool disabled (editflow.workers.enabled=false)");
        }
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        AtomicInteger n = new AtomicInteger();
        workers = Executors.newFixedThreadPool(maxWorkers, r -> new Thread(r, "worker-" + n.incrementAndGet()));
        for (int i = 1; i <= maxWorkers; i++) {
            String workerId = "worker-" + i;
            workers.submit(() -> loop(workerId));
        }
        log.info("Worker pool started with {} workers", maxWorkers);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) return;
        running = false;
        wakeSignal.signal();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30 s; in-flight jobs will be recovered on next start");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Worker pool stopped");
    }

    /** Number of workers currently running a job. */
    public int activeCount() {
        return active.get();
    }

    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Worker loop
    // ------------------------------------------------------------------

    private void loop(String workerId) {
        while (running && !Thread.currentThread().isInterrupted()) {
            long seen = wakeSignal.generation();
            try {
                if (!tryAcquireSlot()) {
                    wakeSignal.awaitChange(seen, idleWait);
                    continue;
                }
                Optional<Job> job;
                try {
                    job = scheduler.selectNext(governor::admits, workerId);
                } catch (RuntimeException e) {
                    releaseSlot();
                    log.error("Selection failed in {}: {}", workerId, e.getMessage(), e);
                    wakeSignal.awaitChange(seen, idleWait);
                    continue;
                }
                if (job.isEmpty()) {
                    releaseSlot();
                    wakeSignal.awaitChange(seen, idleWait);
                    continue;
                }
                try {
                    executor.run(job.get(), workerId);
                } catch (RuntimeException e) {
                    log.error("Unhandled error in {} for job {}: {}",
                            workerId, job.get().getId(), e.getMessage(), e);
                } finally {
                    releaseSlot();
                    // A slot just freed up; let idle workers re-check.
                    wakeSignal.signal();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("{} exiting", workerId);
    }

    private boolean tryAcquireSlot() {
        synchronized (slotLock) {
            int limit = Math.min(maxWorkers, governor.concurrencyLimit());
            if (active.get() >= limit) return false;
            active.incrementAndGet();
            return true;
        }
    }

    private void releaseSlot() {
        active.decrementAndGet();
    }
}
