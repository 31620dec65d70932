package io.mnemo.core.scheduler;

import io.mnemo.core.config.model.StorageConfig;

/**
 * The runtime-tunable part of the scheduler. Feedback and autonomous-mode toggles replace the
 * current instance instead of mutating the config.
 */
public record AutonomousSettings(
    boolean autoOptimizeEnabled,
    double optimizationIntervalHours,
    double maxAutoPurgePercent
) {

    public static AutonomousSettings from(StorageConfig config) {
        return new AutonomousSettings(
            config.autoOptimizeEnabled(),
            config.optimizationIntervalHours(),
            config.maxAutoPurgePercent()
        );
    }

    public AutonomousSettings withAutoOptimizeEnabled(boolean enabled) {
        return new AutonomousSettings(enabled, optimizationIntervalHours, maxAutoPurgePercent);
    }

    public AutonomousSettings withMaxAutoPurgePercent(double percent) {
        return new AutonomousSettings(autoOptimizeEnabled, optimizationIntervalHours, percent);
    }
}
