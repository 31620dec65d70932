package io.mnemo.core.scheduler;

import java.time.Instant;
import java.util.List;

public record OptimizationAnalytics(
    AutonomousSettings settings,
    PerformanceTracking performance,
    List<OptimizationHistoryRecord> recentHistory,
    boolean learningEnabled,
    Instant lastOptimization
) {

    public OptimizationAnalytics {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }
}
