package com.editflow.orchestrator.resource;

import java.time.Instant;

/**
 * One sample of compute pressure.
 *
 * Accelerator fields are null when no accelerator (or no reading) is available.
 *
 * @param cpuPercent          host CPU utilisation 0..100, or -1 if unknown
 * @param acceleratorTempC    accelerator temperature in °C
 * @param acceleratorUsedMb   accelerator memory in use
 * @param acceleratorTotalMb  accelerator memory installed
 */
public record ResourceSnapshot(
        Instant sampledAt,
        double  cpuPercent,
        Double  acceleratorTempC,
        Long    acceleratorUsedMb,
        Long    acceleratorTotalMb
) {
    public boolean hasAccelerator() {
        return acceleratorTotalMb != null;
    }

    /** Free accelerator memory, or null when there is no accelerator reading. */
    public Long acceleratorFreeMb() {
        if (acceleratorTotalMb == null || acceleratorUsedMb == null) return null;
        return Math.max(0, acceleratorTotalMb - acceleratorUsedMb);
    }

    public static ResourceSnapshot cpuOnly(Instant at, double cpuPercent) {
        return new ResourceSnapshot(at, cpuPercent, null, null, null);
    }
}
