package com.editflow.orchestrator.api.dto;

import com.editflow.orchestrator.model.JobStatus;
import com.editflow.orchestrator.service.QueueStats;

import java.util.LinkedHashMap;
import java.util.Map;

/** Response body for GET /jobs/stats. */
public record StatsResponse(
        Map<String, Long>  byStatus,
        Map<Integer, Long> pendingByTier,
        long               oldestPendingAgeSeconds
) {
    public static StatsResponse from(QueueStats stats) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Map.Entry<JobStatus, Long> e : stats.byStatus().entrySet()) {
            byStatus.put(e.getKey().name(), e.getValue());
        }
        return new StatsResponse(byStatus, stats.pendingByTier(), stats.oldestPendingAge().toSeconds());
    }
}
