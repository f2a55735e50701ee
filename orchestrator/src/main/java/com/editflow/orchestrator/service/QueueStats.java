package com.editflow.orchestrator.service;

import com.editflow.orchestrator.model.JobStatus;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time counts for operators.
 *
 * @param byStatus          number of jobs per status (every status present, zero included)
 * @param pendingByTier     number of PENDING jobs per priority tier 1..3
 * @param oldestPendingAge  age of the oldest PENDING job, or {@link Duration#ZERO} if none
 */
public record QueueStats(
        Map<JobStatus, Long> byStatus,
        Map<Integer, Long>   pendingByTier,
        Duration             oldestPendingAge
) {}
