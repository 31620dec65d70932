package io.mnemo.core.policy;

import java.util.Locale;
import java.util.Optional;

public enum MemoryCategory {
    BUG_FIX("bug_fix", 90, 100, 0.9, 0.8),
    ERROR_SOLUTION("error_solution", 120, 150, 0.95, 0.85),
    ARCHITECTURE("architecture", 180, 80, 0.8, 0.7),
    PERFORMANCE("performance", 60, 60, 0.85, 0.75),
    TESTING("testing", 45, 40, 0.7, 0.6),
    DEBUGGING("debugging", 30, 50, 0.8, 0.7),
    DEPLOYMENT("deployment", 90, 50, 0.82, 0.75),
    CONFIGURATION("configuration", 120, 80, 0.88, 0.8),
    DOCUMENTATION("documentation", 365, 200, 0.75, 0.6),
    REFACTORING("refactoring", 60, 30, 0.75, 0.65),
    CODE_IMPLEMENTATION("code_implementation", 90, 100, 0.8, 0.7),
    GENERAL("general", 30, 20, 0.6, 0.5);

    private final String key;
    private final int defaultMaxAgeDays;
    private final int defaultMinRetentionCount;
    private final double defaultPriorityWeight;
    private final double defaultAccessWeight;

    MemoryCategory(
        String key,
        int defaultMaxAgeDays,
        int defaultMinRetentionCount,
        double defaultPriorityWeight,
        double defaultAccessWeight
    ) {
        this.key = key;
        this.defaultMaxAgeDays = defaultMaxAgeDays;
        this.defaultMinRetentionCount = defaultMinRetentionCount;
        this.defaultPriorityWeight = defaultPriorityWeight;
        this.defaultAccessWeight = defaultAccessWeight;
    }

    public String key() {
        return key;
    }

    int defaultMaxAgeDays() {
        return defaultMaxAgeDays;
    }

    int defaultMinRetentionCount() {
        return defaultMinRetentionCount;
    }

    double defaultPriorityWeight() {
        return defaultPriorityWeight;
    }

    double defaultAccessWeight() {
        return defaultAccessWeight;
    }

    public static Optional<MemoryCategory> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (MemoryCategory category : values()) {
            if (category.key.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
