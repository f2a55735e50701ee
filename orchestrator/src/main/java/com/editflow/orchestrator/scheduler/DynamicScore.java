package com.editflow.orchestrator.scheduler;

import com.editflow.orchestrator.model.Job;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Ranking formula for pending jobs:
 * <pre>
 *   score = priorityBonus(tier) + ageBonus(age) + qualityBonus(qualityScore)
 *
 *   priorityBonus : tier 1 → 3.0, tier 2 → 2.0, tier 3 → 1.0
 *   ageBonus      : min(ageHours / ageWindowHours, ageCap)      (defaults 12 h, 2.0)
 *   qualityBonus  : qualityScore ≥ qualityThreshold ? qualityBonus : 0   (defaults 4.5, 1.0)
 * </pre>
 * Age can only grow, so a pending job's score never decreases between passes.
 * With the defaults the age bonus saturates after 24 h, at which point a
 * tier-3 job ties a fresh tier-1 job and wins on FIFO.
 */
@Component
public class DynamicScore {

    private final double ageCap;
    private final double ageWindowHours;
    private final double qualityThreshold;
    private final double qualityBonus;

    public DynamicScore(@Value("${editflow.scheduler.age-cap:2.0}") double ageCap,
                        @Value("${editflow.scheduler.age-window-hours:12}") double ageWindowHours,
                        @Value("${editflow.scheduler.quality-threshold:4.5}") double qualityThreshold,
                        @Value("${editflow.scheduler.quality-bonus:1.0}") double qualityBonus) {
        this.ageCap           = ageCap;
        this.ageWindowHours   = ageWindowHours;
        this.qualityThreshold = qualityThreshold;
        this.qualityBonus     = qualityBonus;
    }

    /** Defaults as documented on the class. */
    public static DynamicScore defaults() {
        return new DynamicScore(2.0, 12, 4.5, 1.0);
    }

    public double score(Job job, Instant now) {
        return priorityBonus(job.getPriorityTier())
             + ageBonus(Duration.between(job.getCreatedAt(), now))
             + qualityBonus(job.getQualityScore());
    }

    public static double priorityBonus(int tier) {
        return switch (tier) {
            case 1  -> 3.0;
            case 2  -> 2.0;
            default -> 1.0;
        };
    }

    public double ageBonus(Duration age) {
        if (age.isNegative()) return 0;
        double hours = age.toMillis() / 3_600_000.0;
        return Math.min(hours / ageWindowHours, ageCap);
    }

    public double qualityBonus(double qualityScore) {
        return qualityScore >= qualityThreshold ? qualityBonus : 0.0;
    }
}
