package com.editflow.orchestrator.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter:
 * {@code min(base * 2^retryCount ± jitterRatio, maxDelay)}.
 */
public class BackoffPolicy {

    private final Duration       baseDelay;
    private final Duration       maxDelay;
    private final double         jitterRatio;
    private final DoubleSupplier random;   // uniform in [0, 1)

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio) {
        this(baseDelay, maxDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio, DoubleSupplier random) {
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1): " + jitterRatio);
        }
        this.baseDelay   = baseDelay;
        this.maxDelay    = maxDelay;
        this.jitterRatio = jitterRatio;
        this.random      = random;
    }

    public Duration delayFor(int retryCount) {
        double baseMs = baseDelay.toMillis() * Math.pow(2, Math.min(retryCount, 30));
        double capped = Math.min(baseMs, maxDelay.toMillis());
        double jitter = capped * jitterRatio * (2 * random.getAsDouble() - 1);
        double ms     = Math.max(0, Math.min(capped + jitter, maxDelay.toMillis()));
        return Duration.ofMillis(Math.round(ms));
    }
}
