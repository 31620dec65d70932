package io.mnemo.core.scheduler;

import io.mnemo.core.optimize.OptimizationResult;
import io.mnemo.core.optimize.StorageReport;

/**
 * Outcome of one {@link AutonomousScheduler#monitorAndOptimize} call. {@code report} is absent
 * for skipped calls; {@code trigger}, {@code optimization} and {@code historyId} only for
 * optimized ones.
 */
public record SchedulerResult(
    Outcome outcome,
    TriggerReason trigger,
    StorageReport report,
    OptimizationResult optimization,
    String historyId
) {

    public enum Outcome {
        OPTIMIZED,
        NOT_DUE,
        SKIPPED_IN_FLIGHT
    }

    static SchedulerResult skipped() {
        return new SchedulerResult(Outcome.SKIPPED_IN_FLIGHT, null, null, null, null);
    }

    static SchedulerResult notDue(StorageReport report) {
        return new SchedulerResult(Outcome.NOT_DUE, null, report, null, null);
    }

    public boolean optimizationPerformed() {
        return outcome == Outcome.OPTIMIZED;
    }
}
