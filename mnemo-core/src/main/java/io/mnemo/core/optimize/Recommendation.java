package io.mnemo.core.optimize;

public record Recommendation(
    String type,
    Priority priority,
    String action,
    String description
) {

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
