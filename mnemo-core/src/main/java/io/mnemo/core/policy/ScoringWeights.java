package io.mnemo.core.policy;

import io.mnemo.core.config.ConfigurationException;

/**
 * Mix of the retention score. The factor weights are applied as-is (not renormalized); the
 * boosts are flat additions for error- and solution-related memories.
 */
public record ScoringWeights(
    double recency,
    double frequency,
    double quality,
    double priority,
    double errorBoost,
    double solutionBoost
) {

    public ScoringWeights {
        requireWeight("recency", recency);
        requireWeight("frequency", frequency);
        requireWeight("quality", quality);
        requireWeight("priority", priority);
        requireWeight("error_boost", errorBoost);
        requireWeight("solution_boost", solutionBoost);
        if (recency + frequency + quality + priority <= 0) {
            throw new ConfigurationException("at least one of recency, frequency, quality and priority weights must be > 0");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.35, 0.25, 0.2, 0.2, 0.1, 0.15);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ConfigurationException(name + " weight must be a finite number >= 0");
        }
    }
}
