package io.mnemo.core.scoring;

import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.policy.RetentionPolicy;
import io.mnemo.core.policy.RetentionPolicyTable;
import io.mnemo.core.time.TimeSource;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps a memory and its category policy to a retention score in [0, 1]; higher means more worth
 * keeping. Stateless apart from the clock, so identical input at the same instant always scores
 * the same.
 */
public final class ScoringEngine {
    public static final double NEUTRAL = 0.5;

    private static final double RECENCY_DECAY = 3.0;
    private static final double ACCESS_SATURATION = 100.0;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final TimeSource timeSource;
    private final RetentionPolicyTable policies;

    public ScoringEngine(TimeSource timeSource, RetentionPolicyTable policies) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
    }

    public double score(MemoryRecord memory) {
        return categoryScore(memory, policies.policyFor(memory.category()));
    }

    public double categoryScore(MemoryRecord memory, RetentionPolicy policy) {
        Objects.requireNonNull(memory, "memory must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        double score = policy.weights().recency() * recencyFactor(memory, policy)
            + policy.weights().frequency() * policy.accessWeight() * frequencyFactor(memory.accessCount())
            + policy.weights().quality() * qualityFactor(memory.successRate())
            + policy.weights().priority() * policy.priorityWeight();
        if (memory.errorRelated()) {
            score += policy.weights().errorBoost();
        }
        if (memory.solutionRelated()) {
            score += policy.weights().solutionBoost();
        }
        return clamp(score);
    }

    /**
     * Exponential decay of the time since last access (or creation), scaled by the category's
     * retention window: 1.0 for "now", about 0.05 at {@code maxAgeDays}.
     */
    public double recencyFactor(MemoryRecord memory, RetentionPolicy policy) {
        Instant touched = timeSource.parse(memory.effectiveLastAccessed());
        if (TimeSource.MAXIMALLY_STALE.equals(touched)) {
            return 0.0;
        }
        return recencyFactor(timeSource.ageOf(touched), policy);
    }

    public double recencyFactor(Duration age, RetentionPolicy policy) {
        double ageDays = age.getSeconds() / SECONDS_PER_DAY;
        return clamp(Math.exp(-RECENCY_DECAY * ageDays / policy.maxAgeDays()));
    }

    public double frequencyFactor(Integer accessCount) {
        if (accessCount == null || accessCount < 0) {
            return NEUTRAL;
        }
        return Math.min(1.0, Math.log1p(accessCount) / Math.log1p(ACCESS_SATURATION));
    }

    public double qualityFactor(Double successRate) {
        if (successRate == null || !Double.isFinite(successRate) || successRate < 0 || successRate > 1) {
            return NEUTRAL;
        }
        return successRate;
    }

    public TimeSource timeSource() {
        return timeSource;
    }

    public RetentionPolicyTable policies() {
        return policies;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return NEUTRAL;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
