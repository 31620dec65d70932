package io.mnemo.core.memory;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Read-only snapshot of one stored memory as supplied by the external store. Timestamps are kept
 * in their wire encoding and resolved by {@link io.mnemo.core.time.TimeSource} when scored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryRecord(
    String id,
    @JsonAlias({"content_size_bytes"}) long contentSizeBytes,
    String category,
    @JsonAlias({"created_at"}) String createdAt,
    @JsonAlias({"last_accessed"}) String lastAccessed,
    @JsonAlias({"access_count"}) Integer accessCount,
    @JsonAlias({"success_rate"}) Double successRate,
    @JsonAlias({"error_related"}) boolean errorRelated,
    @JsonAlias({"solution_related"}) boolean solutionRelated
) {
    public static final String DEFAULT_CATEGORY = "general";

    public MemoryRecord {
        id = id == null ? "" : id.trim();
        contentSizeBytes = Math.max(0, contentSizeBytes);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
    }

    /** Timestamp that recency is measured from: the last access, or creation if never accessed. */
    public String effectiveLastAccessed() {
        return lastAccessed == null || lastAccessed.isBlank() ? createdAt : lastAccessed;
    }
}
