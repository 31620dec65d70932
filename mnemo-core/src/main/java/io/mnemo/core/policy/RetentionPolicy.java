package io.mnemo.core.policy;

import io.mnemo.core.config.ConfigurationException;
import java.time.Duration;

/**
 * Retention bounds for one category. A memory older than {@code maxAgeDays} or scoring below
 * {@code minAcceptableScore} violates the policy; one younger than {@code minAgeBeforePurge} is
 * protected unless capacity is critical. Outside critical capacity, context-aware purging keeps at
 * least {@link #retentionFloor()} healthy memories of the category.
 *
 * <p>{@code priorityWeight} is the category's standing in the score; {@code accessWeight} scales
 * how much access frequency counts for it.
 */
public record RetentionPolicy(
    int maxAgeDays,
    int maxCount,
    int minRetentionCount,
    double minAcceptableScore,
    double priorityWeight,
    double accessWeight,
    ScoringWeights weights,
    Duration minAgeBeforePurge
) {
    public static final double DEFAULT_MIN_ACCEPTABLE_SCORE = 0.3;
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofHours(24);

    public RetentionPolicy {
        if (maxAgeDays <= 0) {
            throw new ConfigurationException("max_age_days must be > 0");
        }
        if (maxCount <= 0) {
            throw new ConfigurationException("max_count must be > 0");
        }
        if (minRetentionCount < 0) {
            throw new ConfigurationException("min_retention_count must be >= 0");
        }
        requireUnit("min_acceptable_score", minAcceptableScore);
        requireUnit("priority_weight", priorityWeight);
        requireUnit("access_weight", accessWeight);
        if (weights == null) {
            throw new ConfigurationException("weights must not be null");
        }
        if (minAgeBeforePurge == null || minAgeBeforePurge.isNegative()) {
            throw new ConfigurationException("min_age_before_purge must be >= 0");
        }
    }

    public Duration maxAge() {
        return Duration.ofDays(maxAgeDays);
    }

    /** Healthy memories context-aware purging leaves in place; never more than {@code maxCount}. */
    public int retentionFloor() {
        return Math.min(minRetentionCount, maxCount);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new ConfigurationException(name + " must be in [0, 1]");
        }
    }
}
