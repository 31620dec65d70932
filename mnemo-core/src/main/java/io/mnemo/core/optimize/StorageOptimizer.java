package io.mnemo.core.optimize;

import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.purge.PurgeStrategy;
import java.util.Collection;
import java.util.List;

/**
 * Decides which memories a store should drop. Implementations never delete anything themselves,
 * so every call is safe as a dry run.
 */
public interface StorageOptimizer {
    StorageReport assess(Collection<MemoryRecord> memories);

    List<Recommendation> recommend(Collection<MemoryRecord> memories);

    OptimizationResult optimize(Collection<MemoryRecord> memories, PurgeStrategy strategy, double targetReduction);

    /**
     * Same as {@link #optimize(Collection, PurgeStrategy, double)}; with {@code criticalOverride}
     * the grace period is ignored as if capacity were critical.
     */
    OptimizationResult optimize(
        Collection<MemoryRecord> memories,
        PurgeStrategy strategy,
        double targetReduction,
        boolean criticalOverride
    );
}
