package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.resource.ResourceGovernor;
import com.editflow.orchestrator.scheduler.WakeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrchestrationServiceTest {

    @Mock IdempotencyGuard guard;
    @Mock JobStore         store;
    @Mock ResourceGovernor governor;

    WakeSignal           wakeSignal;
    OrchestrationService service;

    @BeforeEach
    void setUp() {
        wakeSignal = new WakeSignal();
        service    = new OrchestrationService(guard, store, governor, wakeSignal);
    }

    @Test
    void submit_accepted_wakesWorkers() {
        JobSubmission s = new JobSubmission("job-1", "photo-1", 1, 4.0, "{}");
        when(guard.submit(s)).thenReturn(SubmitResult.accepted(job()));

        service.submit(s);

        assertThat(wakeSignal.generation()).isEqualTo(1);
    }

    @Test
    void submit_rejected_noWakeUp() {
        JobSubmission s = new JobSubmission("job-1", "photo-1", 1, 4.0, "{}");
        when(guard.submit(s)).thenReturn(SubmitResult.duplicate("duplicate: job job-1 already exists", null));

        assertThat(service.submit(s).accepted()).isFalse();
        assertThat(wakeSignal.generation()).isZero();
    }

    @Test
    void adjustPriority_onlyWakesWhenSomethingChanged() {
        when(store.adjustTier("job-1", 1)).thenReturn(Optional.of(job()));
        when(store.adjustTier("job-2", 1)).thenReturn(Optional.empty());

        service.adjustPriority("job-2", 1);
        assertThat(wakeSignal.generation()).isZero();

        service.adjustPriority("job-1", 1);
        assertThat(wakeSignal.generation()).isEqualTo(1);
    }

    @Test
    void pauseAndResume_delegateToGovernor() {
        service.pause();
        service.resume();

        verify(governor).pause();
        verify(governor).resume();
    }

    private static Job job() {
        return new Job("job-1", "photo-1", 1, 4.0, "{}", 0, Instant.parse("2025-03-01T12:00:00Z"));
    }
}
