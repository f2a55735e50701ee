package com.editflow.orchestrator.resource;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.scheduler.WakeSignal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceGovernorTest {

    static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock ResourceSampler sampler;

    WakeSignal          wakeSignal;
    SimpleMeterRegistry meters;
    ResourceGovernor    governor;

    @BeforeEach
    void setUp() {
        wakeSignal = new WakeSignal();
        meters     = new SimpleMeterRegistry();
        governor   = new ResourceGovernor(sampler, wakeSignal, meters, 4, 80, 60, 75, 65);
    }

    // ------------------------------------------------------------------
    // Thermal hysteresis
    // ------------------------------------------------------------------

    @Test
    void thermal_pausesAboveLimit_resumesOnlyBelowResumeThreshold() {
        assertThat(governor.canAdmit()).isTrue();

        governor.apply(gpu(76, 0, 8_000));
        assertThat(governor.canAdmit()).isFalse();

        governor.apply(gpu(70, 0, 8_000));
        assertThat(governor.canAdmit()).as("between 65 and 75 stays paused").isFalse();

        governor.apply(gpu(64, 0, 8_000));
        assertThat(governor.canAdmit()).isTrue();

        governor.apply(gpu(70, 0, 8_000));
        assertThat(governor.canAdmit()).as("between 65 and 75 stays admitting").isTrue();
    }

    @Test
    void thermal_exactlyAtLimitDoesNotPause() {
        governor.apply(gpu(75, 0, 8_000));

        assertThat(governor.canAdmit()).isTrue();
    }

    @Test
    void thermal_missingReadingKeepsPreviousDecision() {
        governor.apply(gpu(80, 0, 8_000));
        governor.apply(ResourceSnapshot.cpuOnly(NOW, 10));

        assertThat(governor.canAdmit()).isFalse();
    }

    // ------------------------------------------------------------------
    // CPU throttling
    // ------------------------------------------------------------------

    @Test
    void cpu_aboveCeilingHalvesLimit_restoredBelowLowWatermark() {
        assertThat(governor.concurrencyLimit()).isEqualTo(4);

        governor.apply(ResourceSnapshot.cpuOnly(NOW, 85));
        assertThat(governor.concurrencyLimit()).isEqualTo(2);
        assertThat(governor.canAdmit()).as("CPU pressure throttles, never pauses").isTrue();

        governor.apply(ResourceSnapshot.cpuOnly(NOW, 70));
        assertThat(governor.concurrencyLimit()).isEqualTo(2);

        governor.apply(ResourceSnapshot.cpuOnly(NOW, 50));
        assertThat(governor.concurrencyLimit()).isEqualTo(4);
    }

    @Test
    void cpu_singleWorkerNeverThrottledToZero() {
        ResourceGovernor single = new ResourceGovernor(sampler, wakeSignal, new SimpleMeterRegistry(), 1, 80, 60, 75, 65);

        single.apply(ResourceSnapshot.cpuOnly(NOW, 99));

        assertThat(single.concurrencyLimit()).isEqualTo(1);
    }

    @Test
    void cpu_unknownReadingIgnored() {
        governor.apply(ResourceSnapshot.cpuOnly(NOW, 90));
        governor.apply(ResourceSnapshot.cpuOnly(NOW, -1));

        assertThat(governor.state().cpuThrottled()).isTrue();
    }

    // ------------------------------------------------------------------
    // Memory gate
    // ------------------------------------------------------------------

    @Test
    void admits_skipsJobNeedingMoreMemoryThanIsFree() {
        governor.apply(gpu(50, 6_000, 8_000));

        assertThat(governor.admits(jobNeeding(1_500))).isTrue();
        assertThat(governor.admits(jobNeeding(2_500))).isFalse();
        assertThat(governor.canAdmit()).as("other jobs still admitted").isTrue();
    }

    @Test
    void admits_withoutAcceleratorReading_memoryIsNotGated() {
        governor.apply(ResourceSnapshot.cpuOnly(NOW, 10));

        assertThat(governor.admits(jobNeeding(64_000))).isTrue();
    }

    // ------------------------------------------------------------------
    // Operator controls, listeners, wake-ups
    // ------------------------------------------------------------------

    @Test
    void pause_blocksAdmissionUntilResumed_evenWhenSensorsAreFine() {
        governor.pause();
        governor.apply(gpu(40, 0, 8_000));
        assertThat(governor.canAdmit()).isFalse();

        governor.resume();
        assertThat(governor.canAdmit()).isTrue();
    }

    @Test
    void listeners_seeEverySample() {
        List<GovernorState> seen = new ArrayList<>();
        governor.addListener(seen::add);

        governor.apply(gpu(50, 0, 8_000));
        governor.apply(gpu(50, 0, 8_000));

        assertThat(seen).hasSize(2);
    }

    @Test
    void wakeSignal_raisedOnlyWhenAdmissionChanges() {
        governor.apply(gpu(50, 1_000, 8_000));
        long before = wakeSignal.generation();

        governor.apply(gpu(51, 1_000, 8_000));
        assertThat(wakeSignal.generation()).isEqualTo(before);

        governor.apply(gpu(80, 1_000, 8_000));
        assertThat(wakeSignal.generation()).isGreaterThan(before);
    }

    @Test
    void sample_samplerFailureKeepsPreviousState() {
        governor.apply(gpu(80, 0, 8_000));
        when(sampler.sample()).thenThrow(new IllegalStateException("sampler broke"));

        governor.sample();

        assertThat(governor.canAdmit()).isFalse();
    }

    @Test
    void gauges_reflectState() {
        governor.apply(gpu(80, 0, 8_000));

        assertThat(meters.get("editflow.resources.paused").gauge().value()).isEqualTo(1.0);
        assertThat(meters.get("editflow.resources.concurrency-limit").gauge().value()).isEqualTo(4.0);
    }

    @Test
    void constructor_resumeAboveLimit_rejected() {
        assertThatThrownBy(() -> new ResourceGovernor(sampler, wakeSignal, meters, 4, 80, 60, 75, 90))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ResourceSnapshot gpu(double tempC, long usedMb, long totalMb) {
        return new ResourceSnapshot(NOW, 20, tempC, usedMb, totalMb);
    }

    private static Job jobNeeding(long mb) {
        return new Job("j-" + mb, "clip", 2, 3.0, null, mb, NOW);
    }
}
