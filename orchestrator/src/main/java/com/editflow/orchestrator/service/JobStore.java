package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of every job and the only place its state is mutated.
 *
 * Each transition runs in its own transaction and re-reads the row under a
 * pessimistic lock, so a transition is always applied to the last committed
 * state of that job. Transitions not allowed by {@link JobStatus} are refused
 * and logged; callers get an empty Optional / false back.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRepository jobRepo;
    private final Clock         clock;

    // Lazily seeded from the table so sequences keep growing across restarts.
    private long lastSequence = -1;

    public JobStore(JobRepository jobRepo, Clock clock) {
        this.jobRepo = jobRepo;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /** Insert a brand-new job. The caller has already checked the id is free. */
    @Transactional
    public Job insert(Job job) {
        job.setSequence(nextSequence());
        Job saved = jobRepo.saveAndFlush(job);
        log.info("Job {} stored (subject={}, tier={}, quality={}, seq={})",
                saved.getId(), saved.getSubjectRef(), saved.getPriorityTier(),
                saved.getQualityScore(), saved.getSequence());
        return saved;
    }

    /** Reset a DEAD_LETTER job into a fresh PENDING submission. */
    @Transactional
    public Optional<Job> resubmit(JobSubmission s) {
        Optional<Job> opt = jobRepo.findByIdForUpdate(s.id());
        if (opt.isEmpty()) return Optional.empty();
        Job job = opt.get();
        if (!transitionAllowed(job, JobStatus.PENDING)) return Optional.empty();

        job.resetForResubmission(s.subjectRef(), s.priorityTier(), s.qualityScore(),
                s.config(), s.requiredMemoryMb(), now());
        job.setSequence(nextSequence());
        log.info("Job {} resubmitted from DEAD_LETTER", job.getId());
        return Optional.of(jobRepo.save(job));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Job> find(String id) {
        return jobRepo.findById(id);
    }

    /** PENDING jobs, oldest first. */
    @Transactional(readOnly = true)
    public List<Job> pending() {
        return jobRepo.findByStatusOrderByCreatedAtAscSequenceAsc(JobStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<Job> processing() {
        return jobRepo.findByStatusOrderByCreatedAtAsc(JobStatus.PROCESSING);
    }

    /** List jobs filtered by status and/or subject; both filters are optional. */
    @Transactional(readOnly = true)
    public List<Job> list(JobStatus status, String subjectRef) {
        if (status != null && subjectRef != null) {
            return jobRepo.findByStatusAndSubjectRefOrderByCreatedAtAsc(status, subjectRef);
        }
        if (status != null) {
            return jobRepo.findByStatusOrderByCreatedAtAsc(status);
        }
        if (subjectRef != null) {
            return jobRepo.findBySubjectRefOrderByCreatedAtAsc(subjectRef);
        }
        return jobRepo.findAllByOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            byStatus.put(s, jobRepo.countByStatus(s));
        }
        Map<Integer, Long> byTier = new LinkedHashMap<>();
        for (int tier = 1; tier <= 3; tier++) {
            byTier.put(tier, jobRepo.countByStatusAndPriorityTier(JobStatus.PENDING, tier));
        }
        Duration oldest = pending().stream()
                .findFirst()
                .map(j -> Duration.between(j.getCreatedAt(), now()))
                .orElse(Duration.ZERO);
        return new QueueStats(byStatus, byTier, oldest);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * PENDING → PROCESSING for one worker.
     *
     * Returns empty if the job is no longer PENDING (cancelled, or claimed by
     * someone else between selection and claim).
     */
    @Transactional
    public Optional<Job> claim(String id, String workerId, double score) {
        Optional<Job> opt = jobRepo.findByIdForUpdate(id);
        if (opt.isEmpty() || opt.get().getStatus() != JobStatus.PENDING) {
            return Optional.empty();
        }
        Job job = opt.get();
        job.setStatus(JobStatus.PROCESSING);
        job.setWorkerId(workerId);
        job.setDynamicScore(score);
        job.setStartedAt(now());
        job.setRetryAt(null);
        job.setAwaitingResources(false);
        log.info("Worker '{}' claimed job {} (score={}, retryCount={})",
                workerId, id, String.format("%.3f", score), job.getRetryCount());
        return Optional.of(jobRepo.save(job));
    }

    @Transactional
    public Optional<Job> saveCheckpoint(String id, String handle) {
        return jobRepo.findByIdForUpdate(id).map(job -> {
            job.setCheckpointHandle(handle);
            return jobRepo.save(job);
        });
    }

    @Transactional
    public Optional<Job> clearCheckpoint(String id) {
        return jobRepo.findByIdForUpdate(id).map(job -> {
            job.setCheckpointHandle(null);
            return jobRepo.save(job);
        });
    }

    /** PROCESSING → COMPLETED. */
    @Transactional
    public Optional<Job> complete(String id) {
        return lockedTransition(id, JobStatus.COMPLETED).map(job -> {
            job.setStatus(JobStatus.COMPLETED);
            job.setCompletedAt(now());
            job.setWorkerId(null);
            log.info("Job {} COMPLETED", id);
            return jobRepo.save(job);
        });
    }

    /** PROCESSING → DEAD_LETTER, recording the final error line. */
    @Transactional
    public Optional<Job> deadLetter(String id, String errorLine) {
        return lockedTransition(id, JobStatus.DEAD_LETTER).map(job -> {
            job.setStatus(JobStatus.DEAD_LETTER);
            job.appendError(errorLine);
            job.setCompletedAt(now());
            job.setWorkerId(null);
            job.setRetryAt(null);
            job.setAwaitingResources(false);
            log.error("Job {} → DEAD_LETTER after {} retries: {}", id, job.getRetryCount(), errorLine);
            return jobRepo.save(job);
        });
    }

    /**
     * Book a retry for a PROCESSING job: bump the counter, append the error
     * and record how re-entry will happen. The job stays PROCESSING (owned by
     * nobody) until {@link #releaseToPending} runs.
     */
    @Transactional
    public Optional<Job> recordRetry(String id, String errorLine, Instant retryAt, boolean awaitingResources) {
        Optional<Job> opt = jobRepo.findByIdForUpdate(id);
        if (opt.isEmpty() || opt.get().getStatus() != JobStatus.PROCESSING) {
            return Optional.empty();
        }
        Job job = opt.get();
        job.incrementRetryCount();
        job.appendError(errorLine);
        job.setWorkerId(null);
        job.setRetryAt(retryAt);
        job.setAwaitingResources(awaitingResources);
        log.warn("Job {} retry {} booked ({}): {}", id, job.getRetryCount(),
                awaitingResources ? "waiting for resources" : "at " + retryAt, errorLine);
        return Optional.of(jobRepo.save(job));
    }

    /**
     * PROCESSING → PENDING once the backoff (or resource wait) is over.
     *
     * Only a job waiting for its retry (owned by no worker) is released, so a
     * late or repeated release never takes a job away from a worker.
     */
    @Transactional
    public Optional<Job> releaseToPending(String id) {
        return lockedTransition(id, JobStatus.PENDING).filter(job -> {
            if (job.getWorkerId() == null) return true;
            log.warn("Not releasing job {}: owned by worker '{}'", id, job.getWorkerId());
            return false;
        }).map(job -> {
            job.setStatus(JobStatus.PENDING);
            job.setRetryAt(null);
            job.setAwaitingResources(false);
            job.setCheckpointHandle(null);
            job.setWorkerId(null);
            job.setStartedAt(null);
            log.info("Job {} back to PENDING (retryCount={})", id, job.getRetryCount());
            return jobRepo.save(job);
        });
    }

    /** Delete a PENDING job. Any other status is refused. */
    @Transactional
    public CancelResult cancel(String id) {
        Optional<Job> opt = jobRepo.findByIdForUpdate(id);
        if (opt.isEmpty()) {
            return CancelResult.refused("job not found: " + id);
        }
        Job job = opt.get();
        if (job.getStatus() != JobStatus.PENDING) {
            return CancelResult.refused("job " + id + " is " + job.getStatus() + ", only PENDING jobs can be cancelled");
        }
        jobRepo.delete(job);
        log.info("Job {} cancelled", id);
        return CancelResult.cancelled();
    }

    /** Change the tier of a PENDING job; the tier is clamped to 1..3. */
    @Transactional
    public Optional<Job> adjustTier(String id, int tier) {
        Optional<Job> opt = jobRepo.findByIdForUpdate(id);
        if (opt.isEmpty() || opt.get().getStatus() != JobStatus.PENDING) {
            return Optional.empty();
        }
        Job job = opt.get();
        int clamped = Math.max(1, Math.min(3, tier));
        log.info("Job {} tier {} → {}", id, job.getPriorityTier(), clamped);
        job.setPriorityTier(clamped);
        return Optional.of(jobRepo.save(job));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<Job> lockedTransition(String id, JobStatus next) {
        return jobRepo.findByIdForUpdate(id).filter(job -> transitionAllowed(job, next));
    }

    private boolean transitionAllowed(Job job, JobStatus next) {
        if (job.getStatus().canTransitionTo(next)) return true;
        log.warn("Refusing transition {} → {} for job {}", job.getStatus(), next, job.getId());
        return false;
    }

    private synchronized long nextSequence() {
        if (lastSequence < 0) {
            lastSequence = jobRepo.findMaxSequence();
        }
        return ++lastSequence;
    }

    private Instant now() {
        return clock.instant();
    }
}
