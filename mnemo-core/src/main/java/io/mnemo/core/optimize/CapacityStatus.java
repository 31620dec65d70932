package io.mnemo.core.optimize;

public enum CapacityStatus {
    NORMAL,
    WARNING,
    CRITICAL;

    static CapacityStatus of(double usage, double warningThreshold, double criticalThreshold) {
        if (usage >= criticalThreshold) {
            return CRITICAL;
        }
        if (usage >= warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }
}
