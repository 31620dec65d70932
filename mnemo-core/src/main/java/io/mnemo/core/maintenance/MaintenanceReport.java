package io.mnemo.core.maintenance;

import io.mnemo.core.optimize.OptimizationResult;
import io.mnemo.core.scheduler.SchedulerResult;

/**
 * What one maintenance pass did to the repository. {@code escalation} is present only when the
 * scheduled run left hard limits exceeded.
 */
public record MaintenanceReport(
    SchedulerResult schedulerResult,
    OptimizationResult escalation,
    int memoriesDeleted,
    int memoriesRemaining
) {

    public boolean escalated() {
        return escalation != null;
    }
}
