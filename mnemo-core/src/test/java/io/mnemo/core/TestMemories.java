package io.mnemo.core;

import io.mnemo.core.config.model.RetentionPolicyConfig;
import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.time.TimeSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Fixture builder for memories aged relative to a fixed {@link #NOW}.
 */
public final class TestMemories {
    public static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private TestMemories() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static TimeSource timeSource() {
        return new TimeSource(fixedClock());
    }

    public static StorageConfig config(int maxMemoriesTotal, double maxTotalSizeMb) {
        return config(maxMemoriesTotal, maxTotalSizeMb, true, true, 100);
    }

    public static StorageConfig config(
        int maxMemoriesTotal,
        double maxTotalSizeMb,
        boolean autoOptimizeEnabled,
        boolean learningEnabled,
        int historyLimit
    ) {
        StorageConfig defaults = StorageConfig.defaults();
        return new StorageConfig(
            maxMemoriesTotal,
            defaults.maxMemoriesPerCategory(),
            defaults.maxMemorySizeBytes(),
            maxTotalSizeMb,
            defaults.warningThreshold(),
            defaults.criticalThreshold(),
            autoOptimizeEnabled,
            defaults.optimizationIntervalHours(),
            defaults.maxAutoPurgePercent(),
            learningEnabled,
            historyLimit,
            Map.of()
        );
    }

    /** Caps one category at {@code maxCount} on top of {@code base}. */
    public static StorageConfig withCategoryLimit(StorageConfig base, String category, int maxCount) {
        return base.withRetentionPolicies(Map.of(category, new RetentionPolicyConfig(null, maxCount, null, null, null, null, null, null)));
    }

    public static Builder memory(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String category = "general";
        private long sizeBytes = 1_000;
        private String createdAt = NOW.minus(Duration.ofDays(5)).toString();
        private String lastAccessed;
        private Integer accessCount;
        private Double successRate;
        private boolean errorRelated;
        private boolean solutionRelated;

        private Builder(String id) {
            this.id = id;
        }

        public Builder category(String value) {
            this.category = value;
            return this;
        }

        public Builder size(long bytes) {
            this.sizeBytes = bytes;
            return this;
        }

        public Builder createdAgo(Duration age) {
            this.createdAt = NOW.minus(age).toString();
            return this;
        }

        public Builder createdAt(String raw) {
            this.createdAt = raw;
            return this;
        }

        public Builder accessedAgo(Duration age) {
            this.lastAccessed = NOW.minus(age).toString();
            return this;
        }

        public Builder lastAccessed(String raw) {
            this.lastAccessed = raw;
            return this;
        }

        public Builder accessCount(Integer value) {
            this.accessCount = value;
            return this;
        }

        public Builder successRate(Double value) {
            this.successRate = value;
            return this;
        }

        public Builder errorRelated() {
            this.errorRelated = true;
            return this;
        }

        public Builder solutionRelated() {
            this.solutionRelated = true;
            return this;
        }

        public MemoryRecord build() {
            return new MemoryRecord(
                id,
                sizeBytes,
                category,
                createdAt,
                lastAccessed,
                accessCount,
                successRate,
                errorRelated,
                solutionRelated
            );
        }
    }
}
