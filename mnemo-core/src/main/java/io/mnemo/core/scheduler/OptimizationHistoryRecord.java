package io.mnemo.core.scheduler;

import io.mnemo.core.optimize.OptimizationStatus;
import io.mnemo.core.purge.PurgeStrategy;
import java.time.Instant;

public record OptimizationHistoryRecord(
    String id,
    Instant timestamp,
    TriggerReason triggerReason,
    PurgeStrategy strategy,
    OptimizationStatus status,
    int memoriesRemoved,
    double sizeSavedMb
) {
}
