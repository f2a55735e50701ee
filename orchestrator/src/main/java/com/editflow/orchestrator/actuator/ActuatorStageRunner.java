package com.editflow.orchestrator.actuator;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs each actuator call with a per-stage deadline.
 *
 * The call itself runs on a separate stage thread; the worker waits at most
 * {@code stageTimeout} for it. A call that overruns is never interrupted: it
 * keeps running on its stage thread until the actuator returns, and the
 * worker carries on treating the stage as timed out.
 *
 * Every call is timed, and calls still running on a stage thread are counted
 * (this includes overrunning calls the worker has already given up on):
 * <pre>
 *   editflow.actuator.duration{stage, status="success|error|timeout"}
 *   editflow.actuator.stage.running
 * </pre>
 */
@Component
public class ActuatorStageRunner {

    private static final Logger log = LoggerFactory.getLogger(ActuatorStageRunner.class);

    private final Duration        stageTimeout;
    private final MeterRegistry   meterRegistry;
    private final ExecutorService stageThreads;
    private final AtomicInteger   running = new AtomicInteger();

    public ActuatorStageRunner(@Value("${editflow.dispatch.stage-timeout-ms:15000}") long stageTimeoutMs,
                               MeterRegistry meterRegistry) {
        this.stageTimeout  = Duration.ofMillis(stageTimeoutMs);
        this.meterRegistry = meterRegistry;
        AtomicInteger n = new AtomicInteger();
        this.stageThreads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "actuator-stage-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        meterRegistry.gauge("editflow.actuator.stage.running", running);
    }

    public <T> StageOutcome<T> run(String stage, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        Callable<T> task = () -> {
            running.incrementAndGet();
            try {
                return call.get();
            } finally {
                running.decrementAndGet();
            }
        };
        Future<T> future = stageThreads.submit(task);
        try {
            return StageOutcome.of(future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            status = "timeout";
            log.warn("Actuator stage '{}' exceeded {} ms; leaving the call to finish on its own ({} stage calls still running)",
                    stage, stageTimeout.toMillis(), running.get());
            return StageOutcome.timeout();
        } catch (ExecutionException e) {
            status = "error";
            Throwable cause = e.getCause();
            RuntimeException err = cause instanceof RuntimeException re
                    ? re
                    : new ActuatorException(stage + " failed: " + cause, cause);
            return StageOutcome.failed(err);
        } catch (InterruptedException e) {
            status = "error";
            Thread.currentThread().interrupt();
            return StageOutcome.failed(new ActuatorException(stage + " interrupted", e));
        } finally {
            sample.stop(meterRegistry.timer("editflow.actuator.duration", "stage", stage, "status", status));
        }
    }

    /** Stage calls currently executing, including ones that already timed out. */
    public int runningCount() {
        return running.get();
    }

    public Duration stageTimeout() {
        return stageTimeout;
    }

    @PreDestroy
    public void shutdown() {
        stageThreads.shutdown();
    }
}
