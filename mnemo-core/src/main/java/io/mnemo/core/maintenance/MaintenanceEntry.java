package io.mnemo.core.maintenance;

import java.time.Instant;

/**
 * One maintenance pass that optimized, as kept by a {@link MaintenanceLog}. {@code id} is the
 * scheduler history id of the run; {@code status} is the final status after any escalation.
 */
public record MaintenanceEntry(
    String id,
    Instant timestamp,
    String trigger,
    String status,
    int memoriesDeleted,
    int memoriesRemaining,
    boolean escalated
) {
    public MaintenanceEntry {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        trigger = trigger == null ? "" : trigger.trim();
        status = status == null ? "" : status.trim();
    }
}
