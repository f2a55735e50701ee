package com.editflow.orchestrator.scheduler;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Picks the next job to run and claims it for the calling worker.
 *
 * Scores are recomputed from scratch on every pass (see {@link DynamicScore});
 * nothing carries over between passes except the inputs. Selection plus the
 * PENDING → PROCESSING claim is a single-writer section, so two workers can
 * never walk away with the same job.
 */
@Component
public class PriorityScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    private final JobStore     store;
    private final DynamicScore dynamicScore;
    private final Clock        clock;

    private final ReentrantLock selectionLock = new ReentrantLock();

    public PriorityScheduler(JobStore store, DynamicScore dynamicScore, Clock clock) {
        this.store        = store;
        this.dynamicScore = dynamicScore;
        this.clock        = clock;
    }

    /** A pending job with the score it got on this pass. */
    record Ranked(Job job, double score) {}

    // Highest score first; equal scores in submission order.
    private static final Comparator<Ranked> ORDER = Comparator
            .comparingDouble(Ranked::score).reversed()
            .thenComparing(r -> r.job().getCreatedAt())
            .thenComparingLong(r -> r.job().getSequence());

    /**
     * Claim the admissible PENDING job with the highest score for {@code workerId}.
     *
     * @return the claimed job (already PROCESSING), or empty if nothing is admissible
     */
    public Optional<Job> selectNext(Predicate<Job> admission, String workerId) {
        selectionLock.lock();
        try {
            Instant now = clock.instant();
            List<Ranked> ranked = store.pending().stream()
                    .map(job -> new Ranked(job, dynamicScore.score(job, now)))
                    .sorted(ORDER)
                    .toList();

            for (Ranked r : ranked) {
                if (!admission.test(r.job())) {
                    log.debug("Job {} skipped: not admissible (score={})", r.job().getId(), r.score());
                    continue;
                }
                // Cancelled between the read and the claim: try the next one.
                Optional<Job> claimed = store.claim(r.job().getId(), workerId, r.score());
                if (claimed.isPresent()) {
                    return claimed;
                }
            }
            return Optional.empty();
        } finally {
            selectionLock.unlock();
        }
    }
}
