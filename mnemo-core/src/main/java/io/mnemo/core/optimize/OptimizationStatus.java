package io.mnemo.core.optimize;

public enum OptimizationStatus {
    NO_ACTION_NEEDED("no_action_needed"),
    OPTIMIZATION_COMPLETED("optimization_completed"),
    CAPACITY_STILL_EXCEEDED("capacity_still_exceeded");

    private final String wireName;

    OptimizationStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
