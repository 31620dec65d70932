package io.mnemo.core.optimize;

import java.util.Map;

/**
 * What a purge decision would cost: how many memories per category, and how many of them were
 * heavily used (more than 10 accesses) or recently touched (recency above 0.8).
 */
public record PerformanceImpact(
    Map<String, Integer> categoryImpact,
    int highAccessMemoriesPurged,
    int recentMemoriesPurged
) {
    public PerformanceImpact {
        categoryImpact = categoryImpact == null ? Map.of() : Map.copyOf(categoryImpact);
    }

    public static PerformanceImpact none() {
        return new PerformanceImpact(Map.of(), 0, 0);
    }
}
