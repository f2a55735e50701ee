package com.editflow.orchestrator.api.dto;

import com.editflow.orchestrator.resource.GovernorState;
import com.editflow.orchestrator.resource.ResourceSnapshot;

import java.time.Instant;

/**
 * Response body for GET /resources and the queue pause/resume endpoints.
 * Sample fields are null until the first sample (accelerator fields stay
 * null on hosts without one).
 */
public record ResourceStatusResponse(
        boolean canAdmit,
        boolean operatorPaused,
        boolean thermalPaused,
        boolean cpuThrottled,
        int     concurrencyLimit,
        Instant sampledAt,
        Double  cpuPercent,
        Double  acceleratorTempC,
        Long    acceleratorUsedMb,
        Long    acceleratorTotalMb
) {
    public static ResourceStatusResponse from(GovernorState state) {
        ResourceSnapshot snap = state.snapshot();
        return new ResourceStatusResponse(
                state.canAdmit(),
                state.operatorPaused(),
                state.thermalPaused(),
                state.cpuThrottled(),
                state.concurrencyLimit(),
                snap == null ? null : snap.sampledAt(),
                snap == null ? null : snap.cpuPercent(),
                snap == null ? null : snap.acceleratorTempC(),
                snap == null ? null : snap.acceleratorUsedMb(),
                snap == null ? null : snap.acceleratorTotalMb()
        );
    }
}
