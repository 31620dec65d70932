package io.mnemo.core.scheduler;

public enum TriggerReason {
    CRITICAL_CAPACITY("critical_capacity"),
    WARNING_CAPACITY("warning_capacity"),
    SCHEDULED_INTERVAL("scheduled_interval"),
    FORCED("forced");

    private final String wireName;

    TriggerReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
