package com.editflow.orchestrator.resource;

import com.editflow.orchestrator.model.Job;
import com.editflow.orchestrator.scheduler.WakeSignal;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Decides whether new work may start, from periodic resource samples.
 *
 * Policy:
 * <ul>
 *   <li>CPU above {@code cpuCeiling} halves the concurrency limit; the limit
 *       is restored only once CPU drops below {@code cpuLowWatermark}.</li>
 *   <li>Accelerator temperature above {@code tempLimit} pauses admission
 *       entirely; it resumes only after a sample below {@code tempResume}.</li>
 *   <li>A job whose declared accelerator memory exceeds what is free is
 *       skipped by {@link #admits(Job)}; nothing else is paused.</li>
 * </ul>
 *
 * The governor is the only writer of its state. Readers get an immutable
 * {@link GovernorState} through a volatile field.
 */
@Component
public class ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private final ResourceSampler sampler;
    private final WakeSignal      wakeSignal;
    private final int             maxWorkers;
    private final double          cpuCeiling;
    private final double          cpuLowWatermark;
    private final double          tempLimit;
    private final double          tempResume;

    private final List<Consumer<GovernorState>> listeners = new CopyOnWriteArrayList<>();

    private volatile GovernorState state;

    public ResourceGovernor(ResourceSampler sampler,
                            WakeSignal wakeSignal,
                            MeterRegistry meterRegistry,
                            @Value("${editflow.workers.max:4}") int maxWorkers,
                            @Value("${editflow.resources.cpu-ceiling:80}") double cpuCeiling,
                            @Value("${editflow.resources.cpu-low-watermark:60}") double cpuLowWatermark,
                            @Value("${editflow.resources.temp-limit:75}") double tempLimit,
                            @Value("${editflow.resources.temp-resume:65}") double tempResume) {
        if (cpuLowWatermark > cpuCeiling || tempResume > tempLimit) {
            throw new IllegalArgumentException("resume thresholds must not exceed their limits");
        }
        this.sampler         = sampler;
        this.wakeSignal      = wakeSignal;
        this.maxWorkers      = maxWorkers;
        this.cpuCeiling      = cpuCeiling;
        this.cpuLowWatermark = cpuLowWatermark;
        this.tempLimit       = tempLimit;
        this.tempResume      = tempResume;
        this.state = new GovernorState(null, false, false, false, maxWorkers);

        Gauge.builder("editflow.resources.concurrency-limit", this, ResourceGovernor::concurrencyLimit)
                .register(meterRegistry);
        Gauge.builder("editflow.resources.paused", this, g -> g.canAdmit() ? 0 : 1)
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public boolean canAdmit() {
        return state.canAdmit();
    }

    public int concurrencyLimit() {
        return state.concurrencyLimit();
    }

    public GovernorState state() {
        return state;
    }

    /**
     * True if enough accelerator memory is free for {@code requiredMb}.
     * Without an accelerator reading there is nothing to gate on.
     */
    public boolean hasMemoryFor(long requiredMb) {
        if (requiredMb <= 0) return true;
        ResourceSnapshot snap = state.snapshot();
        if (snap == null || snap.acceleratorFreeMb() == null) return true;
        return requiredMb <= snap.acceleratorFreeMb();
    }

    /** The admission predicate handed to the scheduler. */
    public boolean admits(Job job) {
        return canAdmit() && hasMemoryFor(job.getRequiredMemoryMb());
    }

    /** Called with the new state after every sample and every operator pause/resume. */
    public void addListener(Consumer<GovernorState> listener) {
        listeners.add(listener);
    }

    // ------------------------------------------------------------------
    // Write side
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${editflow.resources.sample-interval-ms:2000}")
    public void sample() {
        ResourceSnapshot snap;
        try {
            snap = sampler.sample();
        } catch (RuntimeException e) {
            log.warn("Resource sampling failed, keeping previous state: {}", e.getMessage());
            return;
        }
        apply(snap);
    }

    /** Fold one sample into the state. */
    synchronized void apply(ResourceSnapshot snap) {
        GovernorState prev = state;

        boolean cpuThrottled = prev.cpuThrottled();
        if (snap.cpuPercent() >= 0) {
            if (snap.cpuPercent() > cpuCeiling) {
                cpuThrottled = true;
            } else if (snap.cpuPercent() < cpuLowWatermark) {
                cpuThrottled = false;
            }
        }

        // No temperature reading: keep whatever was decided last.
        boolean thermalPaused = prev.thermalPaused();
        if (snap.acceleratorTempC() != null) {
            double temp = snap.acceleratorTempC();
            if (temp > tempLimit) {
                thermalPaused = true;
            } else if (temp < tempResume) {
                thermalPaused = false;
            }
        }

        int limit = cpuThrottled ? Math.max(1, maxWorkers / 2) : maxWorkers;
        GovernorState next = new GovernorState(snap, cpuThrottled, thermalPaused, prev.operatorPaused(), limit);
        state = next;

        if (thermalPaused != prev.thermalPaused()) {
            if (thermalPaused) {
                log.warn("Accelerator at {}°C > {}°C: admission PAUSED", snap.acceleratorTempC(), tempLimit);
            } else {
                log.info("Accelerator at {}°C < {}°C: admission resumed", snap.acceleratorTempC(), tempResume);
            }
        }
        if (cpuThrottled != prev.cpuThrottled()) {
            log.info("CPU at {}%: concurrency limit {} → {}",
                    String.format("%.1f", snap.cpuPercent()), prev.concurrencyLimit(), limit);
        }
        notifyListeners(next);
        if (admissionChanged(prev, next)) {
            wakeSignal.signal();
        }
    }

    // ------------------------------------------------------------------
    // Operator controls
    // ------------------------------------------------------------------

    public synchronized void pause() {
        GovernorState prev = state;
        if (prev.operatorPaused()) return;
        state = new GovernorState(prev.snapshot(), prev.cpuThrottled(), prev.thermalPaused(), true, prev.concurrencyLimit());
        log.warn("Admission paused by operator");
        publish(state);
    }

    public synchronized void resume() {
        GovernorState prev = state;
        if (!prev.operatorPaused()) return;
        state = new GovernorState(prev.snapshot(), prev.cpuThrottled(), prev.thermalPaused(), false, prev.concurrencyLimit());
        log.info("Admission resumed by operator");
        publish(state);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean admissionChanged(GovernorState prev, GovernorState next) {
        if (prev.canAdmit() != next.canAdmit()) return true;
        if (prev.concurrencyLimit() != next.concurrencyLimit()) return true;
        Long before = prev.snapshot() == null ? null : prev.snapshot().acceleratorFreeMb();
        Long after  = next.snapshot().acceleratorFreeMb();
        return after != null && (before == null || after > before);
    }

    private void publish(GovernorState s) {
        notifyListeners(s);
        wakeSignal.signal();
    }

    private void notifyListeners(GovernorState s) {
        for (Consumer<GovernorState> listener : listeners) {
            try {
                listener.accept(s);
            } catch (RuntimeException e) {
                log.warn("Governor listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
