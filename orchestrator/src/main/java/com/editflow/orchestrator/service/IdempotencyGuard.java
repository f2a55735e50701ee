package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Front door for submissions: one stored job per id, ever.
 *
 * A second submission with a known id is rejected without touching the
 * stored record, unless that record is DEAD_LETTER and the caller explicitly
 * asks for resubmission. Submissions are serialised in-process; the primary
 * key constraint catches anything that slips past (e.g. a second instance).
 */
@Component
public class IdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    private final JobStore store;
    private final Clock    clock;

    public IdempotencyGuard(JobStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public synchronized SubmitResult submit(JobSubmission s) {
        Optional<String> invalid = validate(s);
        if (invalid.isPresent()) {
            log.warn("Submission rejected: {}", invalid.get());
            return SubmitResult.invalid(invalid.get());
        }

        Optional<Job> existing = store.find(s.id());
        if (existing.isPresent()) {
            Job job = existing.get();
            if (job.getStatus() == JobStatus.DEAD_LETTER && s.allowResubmission()) {
                return store.resubmit(s)
                        .map(resubmitted -> SubmitResult.accepted(resubmitted))
                        .orElseGet(() -> SubmitResult.duplicate("job " + s.id() + " changed while being resubmitted", job));
            }
            log.info("Duplicate submission for job {} ignored (status={})", s.id(), job.getStatus());
            return SubmitResult.duplicate("duplicate: job " + s.id() + " already exists with status " + job.getStatus(), job);
        }

        try {
            Job job = new Job(s.id(), s.subjectRef(), s.priorityTier(), s.qualityScore(),
                    s.config(), s.requiredMemoryMb(), clock.instant());
            return SubmitResult.accepted(store.insert(job));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent duplicate submission for job {} lost the insert race", s.id());
            return SubmitResult.duplicate("duplicate: job " + s.id() + " already exists", null);
        }
    }

    private static Optional<String> validate(JobSubmission s) {
        if (s.id() == null || s.id().isBlank()) {
            return Optional.of("id must not be blank");
        }
        if (s.subjectRef() == null || s.subjectRef().isBlank()) {
            return Optional.of("subjectRef must not be blank");
        }
        if (s.priorityTier() < 1 || s.priorityTier() > 3) {
            return Optional.of("priorityTier must be 1, 2 or 3 (got " + s.priorityTier() + ")");
        }
        if (s.requiredMemoryMb() < 0) {
            return Optional.of("requiredMemoryMb must not be negative");
        }
        return Optional.empty();
    }
}
