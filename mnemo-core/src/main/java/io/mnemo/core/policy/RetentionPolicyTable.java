package io.mnemo.core.policy;

import io.mnemo.core.config.ConfigurationException;
import io.mnemo.core.config.model.RetentionPolicyConfig;
import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.config.model.WeightsConfig;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete category to policy mapping, validated when built. Lookups by raw category string
 * never fail: anything outside {@link MemoryCategory} resolves to the {@code general} policy.
 */
public final class RetentionPolicyTable {
    private final Map<MemoryCategory, RetentionPolicy> policies;

    private RetentionPolicyTable(Map<MemoryCategory, RetentionPolicy> policies) {
        EnumMap<MemoryCategory, RetentionPolicy> copy = new EnumMap<>(MemoryCategory.class);
        copy.putAll(policies);
        for (MemoryCategory category : MemoryCategory.values()) {
            if (!copy.containsKey(category)) {
                throw new ConfigurationException("missing retention policy for category: " + category.key());
            }
        }
        this.policies = Collections.unmodifiableMap(copy);
    }

    public static RetentionPolicyTable defaults() {
        return fromConfig(StorageConfig.defaults());
    }

    public static RetentionPolicyTable fromConfig(StorageConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();

        EnumMap<MemoryCategory, RetentionPolicy> built = new EnumMap<>(MemoryCategory.class);
        for (MemoryCategory category : MemoryCategory.values()) {
            built.put(category, new RetentionPolicy(
                category.defaultMaxAgeDays(),
                config.maxMemoriesPerCategory(),
                category.defaultMinRetentionCount(),
                RetentionPolicy.DEFAULT_MIN_ACCEPTABLE_SCORE,
                category.defaultPriorityWeight(),
                category.defaultAccessWeight(),
                ScoringWeights.defaults(),
                RetentionPolicy.DEFAULT_GRACE_PERIOD
            ));
        }

        for (Map.Entry<String, RetentionPolicyConfig> entry : config.retentionPolicies().entrySet()) {
            MemoryCategory category = MemoryCategory.fromKey(entry.getKey())
                .orElseThrow(() -> new ConfigurationException("unknown retention policy category: " + entry.getKey()));
            if (entry.getValue() != null) {
                built.put(category, apply(built.get(category), entry.getValue()));
            }
        }
        return new RetentionPolicyTable(built);
    }

    public RetentionPolicy policyFor(MemoryCategory category) {
        return policies.get(category == null ? MemoryCategory.GENERAL : category);
    }

    public RetentionPolicy policyFor(String category) {
        return policyFor(MemoryCategory.fromKey(category).orElse(MemoryCategory.GENERAL));
    }

    public RetentionPolicyTable withPolicy(MemoryCategory category, RetentionPolicy policy) {
        Objects.requireNonNull(category, "category must not be null");
        if (policy == null) {
            throw new ConfigurationException("policy for " + category.key() + " must not be null");
        }
        EnumMap<MemoryCategory, RetentionPolicy> updated = new EnumMap<>(policies);
        updated.put(category, policy);
        return new RetentionPolicyTable(updated);
    }

    public Map<MemoryCategory, RetentionPolicy> asMap() {
        return policies;
    }

    private static RetentionPolicy apply(RetentionPolicy base, RetentionPolicyConfig override) {
        return new RetentionPolicy(
            override.maxAgeDays() == null ? base.maxAgeDays() : override.maxAgeDays(),
            override.maxCount() == null ? base.maxCount() : override.maxCount(),
            override.minRetentionCount() == null ? base.minRetentionCount() : override.minRetentionCount(),
            override.minAcceptableScore() == null ? base.minAcceptableScore() : override.minAcceptableScore(),
            override.priorityWeight() == null ? base.priorityWeight() : override.priorityWeight(),
            override.accessWeight() == null ? base.accessWeight() : override.accessWeight(),
            apply(base.weights(), override.weights()),
            override.minAgeBeforePurgeHours() == null
                ? base.minAgeBeforePurge()
                : hours(override.minAgeBeforePurgeHours())
        );
    }

    private static ScoringWeights apply(ScoringWeights base, WeightsConfig override) {
        if (override == null) {
            return base;
        }
        return new ScoringWeights(
            override.recency() == null ? base.recency() : override.recency(),
            override.frequency() == null ? base.frequency() : override.frequency(),
            override.quality() == null ? base.quality() : override.quality(),
            override.priority() == null ? base.priority() : override.priority(),
            override.errorBoost() == null ? base.errorBoost() : override.errorBoost(),
            override.solutionBoost() == null ? base.solutionBoost() : override.solutionBoost()
        );
    }

    private static Duration hours(double hours) {
        if (!Double.isFinite(hours) || hours < 0) {
            throw new ConfigurationException("min_age_before_purge_hours must be a finite number >= 0");
        }
        return Duration.ofMillis(Math.round(hours * 3_600_000));
    }
}
