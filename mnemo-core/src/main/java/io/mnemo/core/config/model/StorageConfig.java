package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.config.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    int maxMemoriesTotal,
    int maxMemoriesPerCategory,
    long maxMemorySizeBytes,
    double maxTotalSizeMb,
    double warningThreshold,
    double criticalThreshold,
    boolean autoOptimizeEnabled,
    double optimizationIntervalHours,
    double maxAutoPurgePercent,
    boolean learningEnabled,
    int historyLimit,
    Map<String, RetentionPolicyConfig> retentionPolicies
) {

    public StorageConfig {
        retentionPolicies = retentionPolicies == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(retentionPolicies));
    }

    public static StorageConfig defaults() {
        return new StorageConfig(
            10_000,
            2_000,
            10_240,
            100,
            0.8,
            0.95,
            true,
            24,
            0.15,
            true,
            100,
            Map.of()
        );
    }

    public long maxTotalSizeBytes() {
        return (long) (maxTotalSizeMb * 1024 * 1024);
    }

    public StorageConfig withRetentionPolicies(Map<String, RetentionPolicyConfig> policies) {
        return new StorageConfig(
            maxMemoriesTotal,
            maxMemoriesPerCategory,
            maxMemorySizeBytes,
            maxTotalSizeMb,
            warningThreshold,
            criticalThreshold,
            autoOptimizeEnabled,
            optimizationIntervalHours,
            maxAutoPurgePercent,
            learningEnabled,
            historyLimit,
            policies
        );
    }

    public StorageConfig validate() {
        if (maxMemoriesTotal <= 0) {
            throw new ConfigurationException("max_memories_total must be > 0");
        }
        if (maxMemoriesPerCategory <= 0) {
            throw new ConfigurationException("max_memories_per_category must be > 0");
        }
        if (maxMemorySizeBytes <= 0) {
            throw new ConfigurationException("max_memory_size_bytes must be > 0");
        }
        if (!(maxTotalSizeMb > 0) || Double.isInfinite(maxTotalSizeMb)) {
            throw new ConfigurationException("max_total_size_mb must be a positive number");
        }
        if (!(warningThreshold > 0 && warningThreshold <= 1)) {
            throw new ConfigurationException("warning_threshold must be in (0, 1]");
        }
        if (!(criticalThreshold > 0 && criticalThreshold <= 1)) {
            throw new ConfigurationException("critical_threshold must be in (0, 1]");
        }
        if (warningThreshold > criticalThreshold) {
            throw new ConfigurationException("warning_threshold must not exceed critical_threshold");
        }
        if (!(optimizationIntervalHours > 0) || Double.isInfinite(optimizationIntervalHours)) {
            throw new ConfigurationException("optimization_interval_hours must be a positive number");
        }
        if (!(maxAutoPurgePercent >= 0 && maxAutoPurgePercent <= 1)) {
            throw new ConfigurationException("max_auto_purge_percent must be in [0, 1]");
        }
        if (historyLimit < 1) {
            throw new ConfigurationException("history_limit must be >= 1");
        }
        return this;
    }
}
