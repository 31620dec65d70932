package io.mnemo.core.purge;

import java.util.Locale;

public enum PurgeStrategy {
    LRU("lru"),
    PRIORITY_BASED("priority_based"),
    CONTEXT_AWARE("context_aware"),
    HYBRID("hybrid");

    private final String wireName;

    PurgeStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether policy violators count toward the removal target even when no reduction is requested. */
    public boolean policyAware() {
        return this == CONTEXT_AWARE || this == HYBRID;
    }

    public static PurgeStrategy fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (PurgeStrategy strategy : values()) {
                if (strategy.wireName.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + name);
    }
}
