package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.repository.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobStore transitions.
 *
 * The repository is mocked; save() hands back what it was given so each test
 * can inspect the job as it would have been written.
 */
@ExtendWith(MockitoExtension.class)
class JobStoreTest {

    static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock JobRepository jobRepo;

    JobStore store;

    @BeforeEach
    void setUp() {
        store = new JobStore(jobRepo, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(jobRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // insert() / resubmit()
    // ------------------------------------------------------------------

    @Test
    void insert_assignsIncreasingSequenceContinuingFromTable() {
        when(jobRepo.findMaxSequence()).thenReturn(41L);
        when(jobRepo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        Job a = store.insert(newJob("a"));
        Job b = store.insert(newJob("b"));

        assertThat(a.getSequence()).isEqualTo(42);
        assertThat(b.getSequence()).isEqualTo(43);
        verify(jobRepo, times(1)).findMaxSequence();
    }

    @Test
    void resubmit_deadLetter_resetsToFreshPending() {
        Job job = withStatus("job-1", JobStatus.DEAD_LETTER);
        job.incrementRetryCount();
        job.appendError("[attempt 1] FATAL: bad");
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        Optional<Job> result = store.resubmit(new JobSubmission("job-1", "photo-9", 1, 4.9, "{}", 0, true));

        assertThat(result).isPresent();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getRetryCount()).isZero();
        assertThat(job.getErrorMessage()).isNull();
        assertThat(job.getPriorityTier()).isEqualTo(1);
        assertThat(job.getCreatedAt()).isEqualTo(NOW);
    }

    // ------------------------------------------------------------------
    // claim()
    // ------------------------------------------------------------------

    @Test
    void claim_pending_becomesProcessingForWorker() {
        Job job = withStatus("job-1", JobStatus.PENDING);
        job.setRetryAt(NOW.minusSeconds(1));
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        Optional<Job> claimed = store.claim("job-1", "worker-2", 3.5);

        assertThat(claimed).isPresent();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getWorkerId()).isEqualTo("worker-2");
        assertThat(job.getDynamicScore()).isEqualTo(3.5);
        assertThat(job.getStartedAt()).isEqualTo(NOW);
        assertThat(job.getRetryAt()).isNull();
    }

    @Test
    void claim_alreadyProcessing_refused() {
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(withStatus("job-1", JobStatus.PROCESSING)));

        assertThat(store.claim("job-1", "worker-2", 1.0)).isEmpty();
        verify(jobRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Terminal and retry transitions
    // ------------------------------------------------------------------

    @Test
    void complete_processing_recordsCompletion() {
        Job job = withStatus("job-1", JobStatus.PROCESSING);
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        assertThat(store.complete("job-1")).isPresent();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void complete_fromPending_refused() {
        Job job = withStatus("job-1", JobStatus.PENDING);
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        assertThat(store.complete("job-1")).isEmpty();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void recordRetry_thenRelease_roundTripsThroughProcessing() {
        Job job = withStatus("job-1", JobStatus.PROCESSING);
        job.setWorkerId("worker-1");
        job.setCheckpointHandle("cp-1");
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        store.recordRetry("job-1", "[attempt 1] TRANSIENT: busy", NOW.plus(Duration.ofSeconds(1)), false);
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getRetryCount()).isEqualTo(1);
        assertThat(job.getWorkerId()).isNull();
        assertThat(job.getRetryAt()).isEqualTo(NOW.plusSeconds(1));

        store.recordRetry("job-1", "[attempt 2] TRANSIENT: busy", NOW.plusSeconds(2), false);
        assertThat(job.getErrorMessage()).isEqualTo("[attempt 1] TRANSIENT: busy\n[attempt 2] TRANSIENT: busy");

        store.releaseToPending("job-1");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getRetryAt()).isNull();
        assertThat(job.getCheckpointHandle()).isNull();
    }

    @Test
    void releaseToPending_jobOwnedByWorker_leftAlone() {
        Job job = withStatus("job-1", JobStatus.PROCESSING);
        job.setWorkerId("worker-2");
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        assertThat(store.releaseToPending("job-1")).isEmpty();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getWorkerId()).isEqualTo("worker-2");
    }

    @Test
    void deadLetter_appendsFinalError() {
        Job job = withStatus("job-1", JobStatus.PROCESSING);
        job.appendError("[attempt 1] TRANSIENT: busy");
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        store.deadLetter("job-1", "[attempt 2] FATAL: unsupported");

        assertThat(job.getStatus()).isEqualTo(JobStatus.DEAD_LETTER);
        assertThat(job.getErrorMessage()).endsWith("[attempt 2] FATAL: unsupported");
    }

    // ------------------------------------------------------------------
    // cancel() / adjustTier()
    // ------------------------------------------------------------------

    @Test
    void cancel_pending_deletes() {
        Job job = withStatus("job-1", JobStatus.PENDING);
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        assertThat(store.cancel("job-1").ok()).isTrue();
        verify(jobRepo).delete(job);
    }

    @Test
    void cancel_processing_refusedWithReason() {
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(withStatus("job-1", JobStatus.PROCESSING)));

        CancelResult result = store.cancel("job-1");

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).contains("PROCESSING");
        verify(jobRepo, never()).delete(any());
    }

    @Test
    void cancel_unknown_refused() {
        when(jobRepo.findByIdForUpdate("nope")).thenReturn(Optional.empty());

        assertThat(store.cancel("nope").reason()).contains("not found");
    }

    @Test
    void adjustTier_clampsToValidRange() {
        Job job = withStatus("job-1", JobStatus.PENDING);
        when(jobRepo.findByIdForUpdate("job-1")).thenReturn(Optional.of(job));

        store.adjustTier("job-1", 9);
        assertThat(job.getPriorityTier()).isEqualTo(3);

        store.adjustTier("job-1", 0);
        assertThat(job.getPriorityTier()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // stats()
    // ------------------------------------------------------------------

    @Test
    void stats_countsEveryStatusAndOldestPendingAge() {
        when(jobRepo.countByStatus(any())).thenReturn(0L);
        when(jobRepo.countByStatus(JobStatus.PENDING)).thenReturn(2L);
        when(jobRepo.countByStatusAndPriorityTier(eq(JobStatus.PENDING), anyInt())).thenReturn(0L);
        Job old = new Job("old", "photo-1", 3, 1.0, null, 0, NOW.minus(Duration.ofMinutes(90)));
        when(jobRepo.findByStatusOrderByCreatedAtAscSequenceAsc(JobStatus.PENDING)).thenReturn(List.of(old));

        QueueStats stats = store.stats();

        assertThat(stats.byStatus()).containsEntry(JobStatus.PENDING, 2L).containsEntry(JobStatus.COMPLETED, 0L);
        assertThat(stats.byStatus()).hasSize(JobStatus.values().length);
        assertThat(stats.pendingByTier()).containsOnlyKeys(1, 2, 3);
        assertThat(stats.oldestPendingAge()).isEqualTo(Duration.ofMinutes(90));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Job newJob(String id) {
        return new Job(id, "photo-" + id, 2, 3.0, "{}", 0, NOW);
    }

    private static Job withStatus(String id, JobStatus status) {
        Job job = newJob(id);
        job.setStatus(status);
        return job;
    }
}
