package io.mnemo.core.optimize;

import io.mnemo.core.purge.PurgeStrategy;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Eviction decision for one snapshot. Nothing has been deleted yet; the caller applies
 * {@link #purgedMemoryIds()} to its own store.
 */
public record OptimizationResult(
    OptimizationStatus status,
    PurgeStrategy strategyUsed,
    int memoriesRemoved,
    double sizeSavedMb,
    Set<String> purgedMemoryIds,
    PerformanceImpact performanceImpact
) {

    public OptimizationResult {
        purgedMemoryIds = purgedMemoryIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(purgedMemoryIds));
        performanceImpact = performanceImpact == null ? PerformanceImpact.none() : performanceImpact;
    }

    public static OptimizationResult noAction(PurgeStrategy strategy) {
        return new OptimizationResult(OptimizationStatus.NO_ACTION_NEEDED, strategy, 0, 0.0, Set.of(), PerformanceImpact.none());
    }
}
